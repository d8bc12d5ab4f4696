package stakerdb.db;

import com.google.protobuf.ByteString;

/**
 * One named top level collection of ordered keys, as seen from inside a transaction.
 */
public abstract class DBBucket
{
  protected final DBTx tx;
  protected final String name;

  protected DBBucket(DBTx tx, String name)
  {
    this.tx = tx;
    this.name = name;
  }

  public String getName()
  {
    return name;
  }

  /** @return the value or null if there is none */
  public abstract ByteString get(ByteString key);

  public boolean containsKey(ByteString key)
  {
    return get(key) != null;
  }

  public final void put(ByteString key, ByteString value)
  {
    tx.checkWritable();
    if (value == null)
    {
      throw new IllegalArgumentException("null values are not stored");
    }
    putInternal(key, value);
  }

  protected abstract void putInternal(ByteString key, ByteString value);

  /**
   * The cursor must be closed, and it sees writes made earlier in the same transaction.
   */
  public abstract DBCursor newCursor();

}
