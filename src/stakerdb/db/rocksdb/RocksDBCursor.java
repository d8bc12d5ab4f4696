package stakerdb.db.rocksdb;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.Map;

import org.rocksdb.RocksIterator;

import com.google.protobuf.ByteString;

import stakerdb.db.DBCursor;

public class RocksDBCursor extends DBCursor
{
  private final RocksIterator it;

  public RocksDBCursor(RocksIterator it)
  {
    this.it = it;
  }

  private Map.Entry<ByteString, ByteString> current()
  {
    if (!it.isValid()) return null;

    return new SimpleImmutableEntry<ByteString, ByteString>(
      ByteString.copyFrom(it.key()),
      ByteString.copyFrom(it.value()));
  }

  @Override
  public Map.Entry<ByteString, ByteString> first()
  {
    it.seekToFirst();
    return current();
  }

  @Override
  public Map.Entry<ByteString, ByteString> last()
  {
    it.seekToLast();
    return current();
  }

  @Override
  public Map.Entry<ByteString, ByteString> seek(ByteString key)
  {
    it.seek(key.toByteArray());
    return current();
  }

  @Override
  public Map.Entry<ByteString, ByteString> next()
  {
    // RocksDB does not allow moving an invalid iterator
    if (!it.isValid()) return null;
    it.next();
    return current();
  }

  @Override
  public Map.Entry<ByteString, ByteString> prev()
  {
    if (!it.isValid()) return null;
    it.prev();
    return current();
  }

  @Override
  public void close()
  {
    it.close();
  }

}
