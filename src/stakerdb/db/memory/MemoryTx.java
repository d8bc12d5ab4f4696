package stakerdb.db.memory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

import com.google.protobuf.ByteString;

import stakerdb.db.ByteStringComparator;
import stakerdb.db.DBBucket;
import stakerdb.db.DBTx;

/**
 * The first write to a bucket copies the whole bucket, so an update costs
 * time linear in the size of the buckets it touches and N inserts cost O(N^2).
 * Fine for tests and small stores; use rocksdb for anything real.
 */
public class MemoryTx extends DBTx
{
  private final Map<String, TreeMap<ByteString, ByteString>> base;

  // buckets copied on first write in this transaction
  private final HashMap<String, TreeMap<ByteString, ByteString>> dirty = new HashMap<>();

  public MemoryTx(Map<String, TreeMap<ByteString, ByteString>> base, boolean read_only)
  {
    super(read_only);
    this.base = base;
  }

  public static TreeMap<ByteString, ByteString> newBucketMap()
  {
    return new TreeMap<ByteString, ByteString>(new ByteStringComparator());
  }

  @Override
  public DBBucket getBucket(String name)
  {
    if (!base.containsKey(name)) return null;
    return new MemoryBucket(this, name);
  }

  protected TreeMap<ByteString, ByteString> readMap(String name)
  {
    TreeMap<ByteString, ByteString> m = dirty.get(name);
    if (m != null) return m;
    return base.get(name);
  }

  protected TreeMap<ByteString, ByteString> writeMap(String name)
  {
    checkWritable();
    TreeMap<ByteString, ByteString> m = dirty.get(name);
    if (m == null)
    {
      m = newBucketMap();
      m.putAll(base.get(name));
      dirty.put(name, m);
    }
    return m;
  }

  /** @return the state to publish on commit */
  protected Map<String, TreeMap<ByteString, ByteString>> merge()
  {
    if (dirty.isEmpty()) return base;

    HashMap<String, TreeMap<ByteString, ByteString>> next = new HashMap<>(base);
    next.putAll(dirty);
    return Collections.unmodifiableMap(next);
  }

}
