package org.tsumego.oracle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsumego.oracle.exceptions.OracleProtocolException;
import org.tsumego.sgf.NodeAllocator;
import org.tsumego.sgf.SgfNode;
import org.tsumego.sgf.SgfParser;
import org.tsumego.sgf.exceptions.SgfException;

/**
 * Parser for the oracle's textual output.
 *
 * <p>The output has the form {@code <result> <moves><comments>} where {@code <moves>} is a fixed-width 12 character
 * move fragment (e.g. ";B[jj];W[ih]") and {@code <comments>} is a run of comment fields separated by "];C[".  The
 * first comment is the qualitative result from which the score is taken.
 */
public class OracleOutputParser
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Width of the move fragment.
   */
  public static final int MOVE_FRAGMENT_LENGTH = 12;

  private static final Pattern COMMENT_SEPARATOR = Pattern.compile(Pattern.quote("];C["));

  private final SgfParser<? extends SgfNode> mParser;

  /**
   * Create a parser producing plain nodes for the suggested moves.
   */
  public OracleOutputParser()
  {
    this(SgfNode::new);
  }

  /**
   * Create a parser.
   *
   * @param xiAllocator - allocator for the nodes of the suggested moves.
   */
  public OracleOutputParser(NodeAllocator<? extends SgfNode> xiAllocator)
  {
    mParser = new SgfParser<>(xiAllocator);
  }

  /**
   * Parse the oracle's output.
   *
   * @param xiOutput - the output.
   *
   * @return the evaluation.
   *
   * @throws OracleProtocolException if the output isn't in the expected format.
   */
  public EvaluationResult parse(String xiOutput) throws OracleProtocolException
  {
    if (StringUtils.isBlank(xiOutput))
    {
      throw new OracleProtocolException("No output", String.valueOf(xiOutput));
    }

    int lSpace = xiOutput.indexOf(' ');
    if (lSpace < 0)
    {
      throw new OracleProtocolException("Missing separator after result", xiOutput);
    }

    String lResultToken = xiOutput.substring(0, lSpace);
    String lRemainder = xiOutput.substring(lSpace + 1);
    if (lRemainder.length() < MOVE_FRAGMENT_LENGTH)
    {
      throw new OracleProtocolException("Truncated move fragment", xiOutput);
    }

    SgfNode lMoves = parseMoves(lRemainder.substring(0, MOVE_FRAGMENT_LENGTH), xiOutput);
    List<String> lComments = parseComments(lRemainder.substring(MOVE_FRAGMENT_LENGTH));

    ResultVocabulary lResult = ResultVocabulary.fromToken(lComments.get(0));
    EvaluationResult lEvaluation = new EvaluationResult(lMoves,
                                                        lResult.mScore,
                                                        lResult.getStatus(),
                                                        lResultToken,
                                                        lComments,
                                                        xiOutput);
    LOGGER.debug("Oracle result: " + lEvaluation);
    return lEvaluation;
  }

  private SgfNode parseMoves(String xiFragment, String xiOutput) throws OracleProtocolException
  {
    if (StringUtils.isBlank(xiFragment))
    {
      return null;
    }

    try
    {
      SgfNode lRoot = mParser.parse("(" + xiFragment + ")");
      return lRoot.getFirstChild().detach();
    }
    catch (SgfException lEx)
    {
      throw new OracleProtocolException("Invalid move fragment '" + xiFragment + "'", xiOutput, lEx);
    }
  }

  private static List<String> parseComments(String xiTrailer)
  {
    List<String> lComments = new ArrayList<>(Arrays.asList(COMMENT_SEPARATOR.split(xiTrailer, -1)));

    // The first field still carries the opening of the first comment and the last one its closing bracket.
    String lFirst = lComments.get(0);
    lComments.set(0, lFirst.substring(Math.min(3, lFirst.length())));

    int lLastIndex = lComments.size() - 1;
    String lLast = lComments.get(lLastIndex).strip();
    lComments.set(lLastIndex, lLast.isEmpty() ? lLast : lLast.substring(0, lLast.length() - 1));

    return lComments;
  }
}
