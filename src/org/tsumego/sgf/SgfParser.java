package org.tsumego.sgf;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsumego.sgf.exceptions.SgfException;
import org.tsumego.sgf.exceptions.SgfSyntaxException;

/**
 * Parser for game records.
 *
 * <p>Grammar:
 * <pre>
 *   Tree     := '(' Sequence SubTree* ')'
 *   Sequence := Node+
 *   Node     := ';' Property*
 *   Property := KEY Value+
 *   SubTree  := Tree
 * </pre>
 *
 * <p>The parser tracks the set of token categories that are legal next and fails immediately, with the offsets of
 * the offending token, on anything else.  There is no error recovery.
 *
 * <p>A record holds exactly one top-level tree.  The parser returns the record root: a property-less node (created
 * by the allocator like every other node) whose only child is the first node of that tree.
 *
 * @param <NodeType> the type of node produced.
 */
public class SgfParser<NodeType extends SgfNode>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final Set<SgfTokenType> AFTER_START      = EnumSet.of(SgfTokenType.OPEN_GROUP);
  private static final Set<SgfTokenType> AFTER_OPEN_GROUP = EnumSet.of(SgfTokenType.NODE_START);
  private static final Set<SgfTokenType> AFTER_NODE_START = EnumSet.of(SgfTokenType.PROPERTY_KEY,
                                                                       SgfTokenType.NODE_START,
                                                                       SgfTokenType.OPEN_GROUP,
                                                                       SgfTokenType.CLOSE_GROUP);
  private static final Set<SgfTokenType> AFTER_KEY        = EnumSet.of(SgfTokenType.PROPERTY_VALUE,
                                                                       SgfTokenType.EMPTY_VALUE);
  private static final Set<SgfTokenType> AFTER_VALUE      = EnumSet.of(SgfTokenType.PROPERTY_VALUE,
                                                                       SgfTokenType.EMPTY_VALUE,
                                                                       SgfTokenType.PROPERTY_KEY,
                                                                       SgfTokenType.NODE_START,
                                                                       SgfTokenType.OPEN_GROUP,
                                                                       SgfTokenType.CLOSE_GROUP);
  private static final Set<SgfTokenType> AFTER_CLOSE      = EnumSet.of(SgfTokenType.OPEN_GROUP,
                                                                       SgfTokenType.CLOSE_GROUP);

  /**
   * An open group - the node the group hangs from and the token that opened it.
   */
  private static final class OpenGroup
  {
    final SgfNode mAttachPoint;
    final SgfToken mToken;

    OpenGroup(SgfNode xiAttachPoint, SgfToken xiToken)
    {
      mAttachPoint = xiAttachPoint;
      mToken = xiToken;
    }
  }

  private final NodeAllocator<NodeType> mAllocator;

  /**
   * Create a parser producing plain nodes.
   *
   * @return the parser.
   */
  public static SgfParser<SgfNode> create()
  {
    return new SgfParser<>(SgfNode::new);
  }

  /**
   * Create a parser.
   *
   * @param xiAllocator - the allocator for every node of the parsed tree, including the record root.
   */
  public SgfParser(NodeAllocator<NodeType> xiAllocator)
  {
    mAllocator = xiAllocator;
  }

  /**
   * A cheap upper bound on the number of nodes a record will produce: one per node-start marker in the raw text, plus
   * the record root.
   *
   * @param xiSource - the record text.
   *
   * @return the estimate.
   */
  public static int estimateCapacity(String xiSource)
  {
    int lCount = 1;
    for (int i = 0; i < xiSource.length(); i++)
    {
      if (xiSource.charAt(i) == ';')
      {
        lCount++;
      }
    }
    return lCount;
  }

  /**
   * Parse a record.
   *
   * @param xiSource - the record text.
   *
   * @return the record root.
   *
   * @throws SgfException if the record is malformed.
   */
  public NodeType parse(String xiSource) throws SgfException
  {
    return parse(xiSource, 0, null);
  }

  /**
   * Parse a record.
   *
   * @param xiSource           - the record text.
   * @param xiStart            - offset in the text at which the record starts.
   * @param xiProgressListener - listener for lexing progress, or null.
   *
   * @return the record root.
   *
   * @throws SgfException if the record is malformed.
   */
  public NodeType parse(String xiSource, int xiStart, ProgressListener xiProgressListener) throws SgfException
  {
    SgfLexer lLexer = new SgfLexer(xiSource, xiStart, xiProgressListener);
    NodeType lRoot = mAllocator.allocate();
    Deque<OpenGroup> lStack = new ArrayDeque<>();
    SgfNode lCurrent = lRoot;
    String lKey = null;
    Set<SgfTokenType> lAllowed = AFTER_START;
    int lNumNodes = 1;

    while (true)
    {
      SgfToken lToken = lLexer.nextToken();
      SgfTokenType lType = lToken.getType();

      if (lType == SgfTokenType.END)
      {
        if (lAllowed == AFTER_KEY)
        {
          throw new SgfSyntaxException("Property " + lKey + " has no value", lToken.getStart(), lToken.getEnd(),
                                       xiSource);
        }
        if (!lStack.isEmpty())
        {
          SgfToken lOpen = lStack.peek().mToken;
          throw new SgfSyntaxException("Unmatched '('", lOpen.getStart(), lOpen.getEnd(), xiSource);
        }
        if (lRoot.isLeaf())
        {
          throw new SgfSyntaxException("No game tree found", xiStart, xiSource.length(), xiSource);
        }
        break;
      }

      if (!lAllowed.contains(lType))
      {
        throw new SgfSyntaxException("Unexpected " + describe(lToken), lToken.getStart(), lToken.getEnd(), xiSource);
      }

      switch (lType)
      {
        case OPEN_GROUP:
          if (lStack.isEmpty() && !lRoot.isLeaf())
          {
            throw new SgfSyntaxException("Only one game tree is permitted", lToken.getStart(), lToken.getEnd(),
                                         xiSource);
          }
          lStack.push(new OpenGroup(lCurrent, lToken));
          lAllowed = AFTER_OPEN_GROUP;
          break;

        case CLOSE_GROUP:
          if (lStack.isEmpty())
          {
            throw new SgfSyntaxException("Unmatched ')'", lToken.getStart(), lToken.getEnd(), xiSource);
          }
          lCurrent = lStack.pop().mAttachPoint;
          lAllowed = AFTER_CLOSE;
          break;

        case NODE_START:
          NodeType lNode = mAllocator.allocate();
          lCurrent.addChild(lNode);
          lCurrent = lNode;
          lNumNodes++;
          lAllowed = AFTER_NODE_START;
          break;

        case PROPERTY_KEY:
          lKey = lToken.getText();
          lAllowed = AFTER_KEY;
          break;

        case PROPERTY_VALUE:
        case EMPTY_VALUE:
          lCurrent.addPropertyValue(lKey, lToken.getText());
          lAllowed = AFTER_VALUE;
          break;

        default:
          throw new SgfSyntaxException("Unexpected " + describe(lToken), lToken.getStart(), lToken.getEnd(),
                                       xiSource);
      }
    }

    LOGGER.debug("Parsed " + (xiSource.length() - xiStart) + " characters into " + lNumNodes + " nodes");
    return lRoot;
  }

  private static String describe(SgfToken xiToken)
  {
    switch (xiToken.getType())
    {
      case OPEN_GROUP:     return "'('";
      case CLOSE_GROUP:    return "')'";
      case NODE_START:     return "';'";
      case PROPERTY_KEY:   return "property " + xiToken.getText();
      case PROPERTY_VALUE: return "value [" + xiToken.getText() + "]";
      case EMPTY_VALUE:    return "empty value";
      default:             return xiToken.getType().toString();
    }
  }
}
