package stakerdb.db;

import java.util.Map;
import com.google.protobuf.ByteString;

/**
 * Ordered iteration over a bucket.  Every move returns the entry
 * the cursor lands on, or null once it runs off either end.
 */
public abstract class DBCursor implements AutoCloseable
{
  public abstract Map.Entry<ByteString, ByteString> first();
  public abstract Map.Entry<ByteString, ByteString> last();

  /** Positions on the first key greater than or equal to key */
  public abstract Map.Entry<ByteString, ByteString> seek(ByteString key);

  public abstract Map.Entry<ByteString, ByteString> next();
  public abstract Map.Entry<ByteString, ByteString> prev();

  @Override
  public void close()
  {
  }
}
