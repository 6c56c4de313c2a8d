package org.tsumego.sgf;

import java.util.List;
import java.util.Map.Entry;

/**
 * Serializes node trees back into record text.  The output follows exactly the grammar accepted by
 * {@link SgfParser}, so parsing the output reproduces the same tree shape and properties.
 */
public final class SgfWriter
{
  private SgfWriter()
  {
    // Static methods only.
  }

  /**
   * @return the text of a complete record.
   *
   * A record root (a node without properties, as returned by the parser) is not itself written - its child trees are.
   * Any other node is written as the root of a single tree.
   *
   * @param xiRoot - the record root.
   */
  public static String writeRecord(SgfNode xiRoot)
  {
    StringBuilder lBuf = new StringBuilder();
    if (xiRoot.getProperties().isEmpty() && !xiRoot.isLeaf())
    {
      for (SgfNode lChild : xiRoot)
      {
        appendTree(lChild, lBuf);
      }
    }
    else
    {
      appendTree(xiRoot, lBuf);
    }
    return lBuf.toString();
  }

  /**
   * @return the text of the tree rooted at the specified node, e.g. "(;B[dd];W[cc](;B[ee])(;B[dc]))".
   *
   * @param xiNode - the node.
   */
  public static String writeTree(SgfNode xiNode)
  {
    StringBuilder lBuf = new StringBuilder();
    appendTree(xiNode, lBuf);
    return lBuf.toString();
  }

  /**
   * @return the text of a single node (without its children), e.g. ";B[dd]C[comment]".
   *
   * @param xiNode - the node.
   */
  public static String writeNode(SgfNode xiNode)
  {
    StringBuilder lBuf = new StringBuilder();
    appendNode(xiNode, lBuf);
    return lBuf.toString();
  }

  /**
   * @return the value with "]" and "\" escaped so that it can be placed between brackets.
   *
   * @param xiValue - the raw value.
   */
  public static String escape(String xiValue)
  {
    StringBuilder lBuf = new StringBuilder(xiValue.length());
    for (int i = 0; i < xiValue.length(); i++)
    {
      char c = xiValue.charAt(i);
      if ((c == ']') || (c == '\\'))
      {
        lBuf.append('\\');
      }
      lBuf.append(c);
    }
    return lBuf.toString();
  }

  private static void appendTree(SgfNode xiNode, StringBuilder xiBuf)
  {
    xiBuf.append('(');

    // Write the sequence, then the variations hanging off its last node.
    SgfNode lNode = xiNode;
    while (true)
    {
      appendNode(lNode, xiBuf);
      if (lNode.getNumChildren() == 1)
      {
        lNode = lNode.getFirstChild();
        continue;
      }

      for (SgfNode lChild : lNode)
      {
        appendTree(lChild, xiBuf);
      }
      break;
    }

    xiBuf.append(')');
  }

  private static void appendNode(SgfNode xiNode, StringBuilder xiBuf)
  {
    xiBuf.append(';');
    for (Entry<String, List<String>> lProperty : xiNode.getProperties().entrySet())
    {
      xiBuf.append(lProperty.getKey());
      if (lProperty.getValue().isEmpty())
      {
        xiBuf.append("[]");
      }
      for (String lValue : lProperty.getValue())
      {
        xiBuf.append('[').append(escape(lValue)).append(']');
      }
    }
  }
}
