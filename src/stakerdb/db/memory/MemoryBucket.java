package stakerdb.db.memory;

import com.google.protobuf.ByteString;

import stakerdb.db.DBBucket;
import stakerdb.db.DBCursor;

public class MemoryBucket extends DBBucket
{
  private final MemoryTx mtx;

  public MemoryBucket(MemoryTx tx, String name)
  {
    super(tx, name);
    this.mtx = tx;
  }

  @Override
  public ByteString get(ByteString key)
  {
    return mtx.readMap(name).get(key);
  }

  @Override
  protected void putInternal(ByteString key, ByteString value)
  {
    mtx.writeMap(name).put(key, value);
  }

  @Override
  public DBCursor newCursor()
  {
    return new MemoryCursor(mtx, name);
  }

}
