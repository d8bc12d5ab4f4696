package stakerdb.db.rocksdb;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.FlushOptions;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.Snapshot;
import org.rocksdb.Transaction;
import org.rocksdb.TransactionDB;
import org.rocksdb.TransactionDBOptions;
import org.rocksdb.WriteOptions;

import stakerdb.Config;
import stakerdb.EventLog;
import stakerdb.StakerDBException;
import stakerdb.db.DB;
import stakerdb.db.DBAction;

/**
 * RocksDB backend.  Each bucket is a column family, updates are
 * RocksDB transactions and views read from a snapshot.
 */
public class JRocksDB extends DB
{
  private TransactionDB db;
  private DBOptions options;
  private TransactionDBOptions tx_options;
  private ColumnFamilyOptions cf_options;
  private WriteOptions write_options;
  private final ConcurrentHashMap<String, ColumnFamilyHandle> handles = new ConcurrentHashMap<>();
  private final Object write_lock = new Object();

  public JRocksDB(Config config, EventLog log)
    throws RocksDBException
  {
    super(config, log);

    config.require("rocksdb_path");
    String path = config.get("rocksdb_path");

    new File(path).mkdirs();

    RocksDB.loadLibrary();

    options = new DBOptions();
    options.setCreateIfMissing(true);
    options.setCreateMissingColumnFamilies(true);
    options.setIncreaseParallelism(4);

    tx_options = new TransactionDBOptions();
    cf_options = new ColumnFamilyOptions();

    write_options = new WriteOptions();
    write_options.setSync(config.getBoolean("rocksdb_sync"));

    List<ColumnFamilyDescriptor> descriptors = new LinkedList<>();
    for(byte[] cf_name : listExisting(path))
    {
      descriptors.add(new ColumnFamilyDescriptor(cf_name, cf_options));
    }

    List<ColumnFamilyHandle> handle_list = new ArrayList<>();
    db = TransactionDB.open(options, tx_options, path, descriptors, handle_list);

    for(ColumnFamilyHandle h : handle_list)
    {
      handles.put(new String(h.getName(), StandardCharsets.UTF_8), h);
    }

    log.log("RocksDB: opened " + path + " with " + handles.size() + " column families");
  }

  private static List<byte[]> listExisting(String path)
    throws RocksDBException
  {
    List<byte[]> lst = new LinkedList<>();

    if (new File(path, "CURRENT").exists())
    {
      try(Options o = new Options())
      {
        lst.addAll(RocksDB.listColumnFamilies(o, path));
      }
    }
    if (lst.isEmpty())
    {
      lst.add(RocksDB.DEFAULT_COLUMN_FAMILY);
    }
    return lst;
  }

  @Override
  protected void openBucketInternal(String name)
  {
    if (handles.containsKey(name)) return;

    try
    {
      ColumnFamilyHandle h = db.createColumnFamily(
        new ColumnFamilyDescriptor(name.getBytes(StandardCharsets.UTF_8), cf_options));
      handles.put(name, h);
      log.log("RocksDB: created column family " + name);
    }
    catch(RocksDBException e)
    {
      throw new RuntimeException(e);
    }
  }

  protected ColumnFamilyHandle getHandle(String name)
  {
    return handles.get(name);
  }

  protected TransactionDB getRocksDB()
  {
    return db;
  }

  @Override
  protected <T> T viewInternal(DBAction<T> action)
    throws StakerDBException
  {
    Snapshot snap = db.getSnapshot();
    try(ReadOptions read_options = new ReadOptions())
    {
      read_options.setSnapshot(snap);
      return action.run(new RocksDBTx(this, null, read_options, true));
    }
    finally
    {
      db.releaseSnapshot(snap);
    }
  }

  @Override
  protected <T> T updateInternal(DBAction<T> action)
    throws StakerDBException
  {
    synchronized(write_lock)
    {
      Transaction txn = db.beginTransaction(write_options);
      ReadOptions read_options = new ReadOptions();
      try
      {
        T result = action.run(new RocksDBTx(this, txn, read_options, false));
        txn.commit();
        return result;
      }
      catch(RocksDBException e)
      {
        rollback(txn, e);
        throw new RuntimeException(e);
      }
      catch(StakerDBException | RuntimeException e)
      {
        rollback(txn, e);
        throw e;
      }
      finally
      {
        read_options.close();
        txn.close();
      }
    }
  }

  private void rollback(Transaction txn, Exception cause)
  {
    try
    {
      txn.rollback();
    }
    catch(RocksDBException e)
    {
      cause.addSuppressed(e);
      log.logTrace(e);
    }
  }

  @Override
  protected void dbShutdownHandler()
    throws Exception
  {
    log.alarm("RocksDB: flushing");
    try(FlushOptions fl = new FlushOptions())
    {
      fl.setWaitForFlush(true);
      db.flush(fl, new ArrayList<ColumnFamilyHandle>(handles.values()));
    }
    log.alarm("RocksDB: flush complete");

    for(Map.Entry<String, ColumnFamilyHandle> me : handles.entrySet())
    {
      me.getValue().close();
    }
    handles.clear();
    db.close();
    write_options.close();
    cf_options.close();
    tx_options.close();
    options.close();
  }

}
