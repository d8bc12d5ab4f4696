package stakerdb.db.memory;

import java.util.Map;
import java.util.TreeMap;

import com.google.protobuf.ByteString;

import stakerdb.db.DBCursor;

/**
 * Looks the map up again on every move, so writes made through the
 * same transaction after the cursor was created are visible.
 */
public class MemoryCursor extends DBCursor
{
  private final MemoryTx tx;
  private final String name;
  private ByteString current;

  public MemoryCursor(MemoryTx tx, String name)
  {
    this.tx = tx;
    this.name = name;
  }

  private TreeMap<ByteString, ByteString> map()
  {
    return tx.readMap(name);
  }

  private Map.Entry<ByteString, ByteString> land(Map.Entry<ByteString, ByteString> e)
  {
    if (e == null)
    {
      current = null;
      return null;
    }
    current = e.getKey();
    return e;
  }

  @Override
  public Map.Entry<ByteString, ByteString> first()
  {
    return land(map().firstEntry());
  }

  @Override
  public Map.Entry<ByteString, ByteString> last()
  {
    return land(map().lastEntry());
  }

  @Override
  public Map.Entry<ByteString, ByteString> seek(ByteString key)
  {
    return land(map().ceilingEntry(key));
  }

  @Override
  public Map.Entry<ByteString, ByteString> next()
  {
    if (current == null) return null;
    return land(map().higherEntry(current));
  }

  @Override
  public Map.Entry<ByteString, ByteString> prev()
  {
    if (current == null) return null;
    return land(map().lowerEntry(current));
  }

}
