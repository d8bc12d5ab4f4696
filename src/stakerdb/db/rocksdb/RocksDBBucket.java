package stakerdb.db.rocksdb;

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

import com.google.protobuf.ByteString;

import stakerdb.db.DBBucket;
import stakerdb.db.DBCursor;

public class RocksDBBucket extends DBBucket
{
  private final RocksDBTx rtx;
  private final ColumnFamilyHandle cf;

  public RocksDBBucket(RocksDBTx tx, String name, ColumnFamilyHandle cf)
  {
    super(tx, name);
    this.rtx = tx;
    this.cf = cf;
  }

  @Override
  public ByteString get(ByteString key)
  {
    try
    {
      byte[] r;
      if (rtx.txn != null)
      {
        r = rtx.txn.get(cf, rtx.read_options, key.toByteArray());
      }
      else
      {
        r = rtx.jdb.getRocksDB().get(cf, rtx.read_options, key.toByteArray());
      }
      if (r == null) return null;

      return ByteString.copyFrom(r);
    }
    catch(RocksDBException e)
    {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected void putInternal(ByteString key, ByteString value)
  {
    try
    {
      rtx.txn.put(cf, key.toByteArray(), value.toByteArray());
    }
    catch(RocksDBException e)
    {
      throw new RuntimeException(e);
    }
  }

  @Override
  public DBCursor newCursor()
  {
    RocksIterator it;
    if (rtx.txn != null)
    {
      it = rtx.txn.getIterator(rtx.read_options, cf);
    }
    else
    {
      it = rtx.jdb.getRocksDB().newIterator(cf, rtx.read_options);
    }
    return new RocksDBCursor(it);
  }

}
