package stakerdb;

import java.util.Map;

import com.google.protobuf.ByteString;

import stakerdb.db.DBCursor;

/**
 * Walks a bucket keyed by 8 byte big endian index, starting from an
 * index offset, in either direction, until enough entries were accepted.
 */
public class Paginator
{
  /**
   * Decides whether an entry counts toward the page.
   * Entries it rejects do not use up the limit.
   */
  public interface Accumulator
  {
    public boolean accept(ByteString key, ByteString value) throws StakerDBException;
  }

  private final DBCursor cursor;
  private final boolean reversed;
  private final long index_offset;
  private final long total_items;

  /**
   * @param index_offset forward: start after this index.
   *   reversed: start below index_offset+1, or at the end when 0
   * @param total_items how many accepted entries to stop at
   */
  public Paginator(DBCursor cursor, boolean reversed, long index_offset, long total_items)
  {
    if (index_offset < 0) throw new IllegalArgumentException("Negative offset: " + index_offset);
    if (total_items < 0) throw new IllegalArgumentException("Negative limit: " + total_items);

    this.cursor = cursor;
    this.reversed = reversed;
    this.index_offset = index_offset;
    this.total_items = total_items;
  }

  private Map.Entry<ByteString, ByteString> cursorStart()
  {
    Map.Entry<ByteString, ByteString> e = null;

    // offset at the top of the range means there is nothing after it
    if (index_offset < Long.MAX_VALUE)
    {
      e = cursor.seek(Util.uint64Key(index_offset + 1));
    }

    if (reversed)
    {
      if (index_offset == 0 || e == null)
      {
        e = cursor.last();
      }
      else
      {
        e = cursor.prev();
      }
    }
    return e;
  }

  private Map.Entry<ByteString, ByteString> nextKey()
  {
    if (reversed) return cursor.prev();
    return cursor.next();
  }

  public void query(Accumulator acc)
    throws StakerDBException
  {
    long accepted = 0;

    for(Map.Entry<ByteString, ByteString> e = cursorStart(); e != null; e = nextKey())
    {
      if (accepted >= total_items) break;

      if (acc.accept(e.getKey(), e.getValue()))
      {
        accepted++;
      }
    }
  }

}
