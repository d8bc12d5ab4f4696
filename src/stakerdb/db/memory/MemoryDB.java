package stakerdb.db.memory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

import com.google.protobuf.ByteString;

import stakerdb.Config;
import stakerdb.EventLog;
import stakerdb.StakerDBException;
import stakerdb.db.DB;
import stakerdb.db.DBAction;

/**
 * Copy on write in-memory backend.  A committed state is never modified,
 * so a view just holds on to whichever state was current when it started.
 * Meant for tests, see MemoryTx for what each update copies.
 */
public class MemoryDB extends DB
{
  private volatile Map<String, TreeMap<ByteString, ByteString>> state = Collections.emptyMap();
  private final Object write_lock = new Object();

  public MemoryDB(Config conf, EventLog log)
  {
    super(conf, log);
    log.log("MemoryDB: opened");
  }

  @Override
  protected void openBucketInternal(String name)
  {
    synchronized(write_lock)
    {
      if (state.containsKey(name)) return;

      HashMap<String, TreeMap<ByteString, ByteString>> next = new HashMap<>(state);
      next.put(name, MemoryTx.newBucketMap());
      state = Collections.unmodifiableMap(next);
    }
  }

  @Override
  protected <T> T viewInternal(DBAction<T> action)
    throws StakerDBException
  {
    MemoryTx tx = new MemoryTx(state, true);
    return action.run(tx);
  }

  @Override
  protected <T> T updateInternal(DBAction<T> action)
    throws StakerDBException
  {
    synchronized(write_lock)
    {
      MemoryTx tx = new MemoryTx(state, false);

      T result = action.run(tx);

      state = tx.merge();
      return result;
    }
  }

}
