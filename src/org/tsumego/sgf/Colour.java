package org.tsumego.sgf;

/**
 * The two players.  Each colour is identified in a record by the property key that carries its moves.
 */
public enum Colour
{
  /**
   * Black - moves are stored under "B".
   */
  BLACK("B"),

  /**
   * White - moves are stored under "W".
   */
  WHITE("W");

  /**
   * The property key under which moves of this colour are stored.
   */
  public final String mKey;

  private Colour(String xiKey)
  {
    mKey = xiKey;
  }

  /**
   * @return the other colour.
   */
  public Colour opponent()
  {
    return (this == BLACK) ? WHITE : BLACK;
  }

  /**
   * @return the colour whose moves are stored under the specified property key, or null if the key isn't a move key.
   *
   * @param xiKey - the property key.
   */
  public static Colour fromKey(String xiKey)
  {
    if (BLACK.mKey.equals(xiKey))
    {
      return BLACK;
    }
    if (WHITE.mKey.equals(xiKey))
    {
      return WHITE;
    }
    return null;
  }
}
