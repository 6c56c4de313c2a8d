package org.tsumego.sgf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * A node in a game record.
 *
 * Each node is one position transition (a move, setup stones or the record root) holding an ordered mapping from
 * property keys to ordered value lists.  Children form a singly-linked sibling chain hanging off the first child, so a
 * node owns its first child and each child owns its next sibling.  The parent link is a back-reference only.
 *
 * The colour of the move stored on the node is derived from its properties as they are set and cached, so that
 * colour-to-move inference never has to probe the property map.
 */
public class SgfNode implements Iterable<SgfNode>
{
  private final Map<String, List<String>> mProperties = new LinkedHashMap<>();

  private SgfNode mParent;
  private SgfNode mFirstChild;
  private SgfNode mLastChild;
  private SgfNode mNextSibling;
  private int mNumChildren;

  private Colour mMoveColour;

  /**
   * @return the parent of this node, or null for a root (or detached) node.
   */
  public SgfNode getParent()
  {
    return mParent;
  }

  /**
   * @return the first child of this node, or null if there are no children.
   */
  public SgfNode getFirstChild()
  {
    return mFirstChild;
  }

  /**
   * @return the next sibling of this node, or null if this is the last child of its parent.
   */
  public SgfNode getNextSibling()
  {
    return mNextSibling;
  }

  /**
   * @return the number of direct children.
   */
  public int getNumChildren()
  {
    return mNumChildren;
  }

  /**
   * @return whether this node has no children.
   */
  public boolean isLeaf()
  {
    return mFirstChild == null;
  }

  /**
   * @return the child at the specified position in child order.
   *
   * @param xiIndex - the index of the child.
   */
  public SgfNode getChild(int xiIndex)
  {
    if ((xiIndex < 0) || (xiIndex >= mNumChildren))
    {
      throw new IndexOutOfBoundsException("Child " + xiIndex + " of " + mNumChildren);
    }

    SgfNode lChild = mFirstChild;
    for (int i = 0; i < xiIndex; i++)
    {
      lChild = lChild.mNextSibling;
    }
    return lChild;
  }

  /**
   * @return a snapshot of the children of this node, in child order.
   */
  public List<SgfNode> getChildren()
  {
    List<SgfNode> lChildren = new ArrayList<>(mNumChildren);
    for (SgfNode lChild = mFirstChild; lChild != null; lChild = lChild.mNextSibling)
    {
      lChildren.add(lChild);
    }
    return lChildren;
  }

  /**
   * Iterate over the direct children of this node, in child order.
   */
  @Override
  public Iterator<SgfNode> iterator()
  {
    return new Iterator<SgfNode>()
    {
      private SgfNode mNext = mFirstChild;

      @Override
      public boolean hasNext()
      {
        return mNext != null;
      }

      @Override
      public SgfNode next()
      {
        if (mNext == null)
        {
          throw new NoSuchElementException();
        }
        SgfNode lResult = mNext;
        mNext = mNext.mNextSibling;
        return lResult;
      }
    };
  }

  /**
   * Append a child to the end of this node's child list.  If the child is currently attached elsewhere, it is
   * detached first (taking its own subtree, but not its former siblings, with it).
   *
   * @param xiChild - the child to add.
   */
  public void addChild(SgfNode xiChild)
  {
    // Refuse anything that would make the tree cyclic.
    for (SgfNode lAncestor = this; lAncestor != null; lAncestor = lAncestor.mParent)
    {
      if (lAncestor == xiChild)
      {
        throw new IllegalArgumentException("Can't add a node beneath itself");
      }
    }

    xiChild.detach();

    if (mFirstChild == null)
    {
      mFirstChild = xiChild;
    }
    else
    {
      mLastChild.mNextSibling = xiChild;
    }
    mLastChild = xiChild;
    xiChild.mParent = this;
    mNumChildren++;
  }

  /**
   * Unlink this node from its parent, repairing the parent's sibling chain.  The node keeps its own children.
   *
   * @return this node.
   */
  public SgfNode detach()
  {
    if (mParent != null)
    {
      SgfNode lPrevious = null;
      if (mParent.mFirstChild == this)
      {
        mParent.mFirstChild = mNextSibling;
      }
      else
      {
        lPrevious = mParent.mFirstChild;
        while (lPrevious.mNextSibling != this)
        {
          lPrevious = lPrevious.mNextSibling;
        }
        lPrevious.mNextSibling = mNextSibling;
      }

      if (mParent.mLastChild == this)
      {
        mParent.mLastChild = lPrevious;
      }

      mParent.mNumChildren--;
      mParent = null;
    }

    mNextSibling = null;
    return this;
  }

  /**
   * @return the number of edges between this node and the root of its tree.
   */
  public int getDepth()
  {
    int lDepth = 0;
    for (SgfNode lNode = mParent; lNode != null; lNode = lNode.mParent)
    {
      lDepth++;
    }
    return lDepth;
  }

  /**
   * @return the root of the tree this node belongs to.
   */
  public SgfNode getRoot()
  {
    SgfNode lNode = this;
    while (lNode.mParent != null)
    {
      lNode = lNode.mParent;
    }
    return lNode;
  }

  /**
   * @return the last node reached by following first children from this node.
   */
  public SgfNode getMainLineEnd()
  {
    SgfNode lNode = this;
    while (lNode.mFirstChild != null)
    {
      lNode = lNode.mFirstChild;
    }
    return lNode;
  }

  /**
   * Set the values of a property, replacing any previous values under the same key.
   *
   * @param xiKey    - the property key.
   * @param xiValues - the values, in order.
   */
  public void setProperty(String xiKey, List<String> xiValues)
  {
    mProperties.put(xiKey, new ArrayList<>(xiValues));
    if (mMoveColour == null)
    {
      mMoveColour = Colour.fromKey(xiKey);
    }
  }

  /**
   * Append a value to a property, creating the property if it isn't already present.
   *
   * @param xiKey   - the property key.
   * @param xiValue - the value.
   */
  public void addPropertyValue(String xiKey, String xiValue)
  {
    mProperties.computeIfAbsent(xiKey, k -> new ArrayList<>()).add(xiValue);
    if (mMoveColour == null)
    {
      mMoveColour = Colour.fromKey(xiKey);
    }
  }

  /**
   * Remove a property.
   *
   * @param xiKey - the property key.
   *
   * @return the values that were removed, or null if the property wasn't present.
   */
  public List<String> removeProperty(String xiKey)
  {
    List<String> lRemoved = mProperties.remove(xiKey);
    if ((lRemoved != null) && (Colour.fromKey(xiKey) != null))
    {
      mMoveColour = null;
      for (String lKey : mProperties.keySet())
      {
        mMoveColour = Colour.fromKey(lKey);
        if (mMoveColour != null)
        {
          break;
        }
      }
    }
    return lRemoved;
  }

  /**
   * @return whether the node carries the specified property.
   *
   * @param xiKey - the property key.
   */
  public boolean hasProperty(String xiKey)
  {
    return mProperties.containsKey(xiKey);
  }

  /**
   * @return the values of the specified property (unmodifiable), or null if the node doesn't carry it.
   *
   * @param xiKey - the property key.
   */
  public List<String> getProperty(String xiKey)
  {
    List<String> lValues = mProperties.get(xiKey);
    return (lValues == null) ? null : Collections.unmodifiableList(lValues);
  }

  /**
   * @return the first value of the specified property, or null if the node doesn't carry it.
   *
   * @param xiKey - the property key.
   */
  public String getFirstValue(String xiKey)
  {
    List<String> lValues = mProperties.get(xiKey);
    return ((lValues == null) || lValues.isEmpty()) ? null : lValues.get(0);
  }

  /**
   * @return the property keys in insertion order.
   */
  public Set<String> getPropertyKeys()
  {
    return Collections.unmodifiableSet(mProperties.keySet());
  }

  /**
   * @return an unmodifiable view of all the properties, in insertion order.
   */
  public Map<String, List<String>> getProperties()
  {
    return Collections.unmodifiableMap(mProperties);
  }

  /**
   * @return the colour that played the move stored on this node, or null if there's no move here.
   */
  public Colour getMoveColour()
  {
    return mMoveColour;
  }

  /**
   * @return the coordinate of the move stored on this node, or null if there's no move here.
   */
  public String getMoveCoordinate()
  {
    return (mMoveColour == null) ? null : getFirstValue(mMoveColour.mKey);
  }

  /**
   * @return the move on this node in record syntax (e.g. "B[dd]"), or null if there's no move here.
   */
  public String getMoveString()
  {
    if (mMoveColour == null)
    {
      return null;
    }
    String lCoordinate = getMoveCoordinate();
    return mMoveColour.mKey + "[" + ((lCoordinate == null) ? "" : lCoordinate) + "]";
  }

  /**
   * @return the colour to move among this node's children, inferred from the move on this node, or null if this node
   *         carries no move.
   */
  public Colour getColourToMove()
  {
    return (mMoveColour == null) ? null : mMoveColour.opponent();
  }

  @Override
  public String toString()
  {
    return SgfWriter.writeNode(this);
  }
}
