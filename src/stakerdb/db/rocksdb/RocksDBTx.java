package stakerdb.db.rocksdb;

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.Transaction;

import stakerdb.db.DBBucket;
import stakerdb.db.DBTx;

public class RocksDBTx extends DBTx
{
  protected final JRocksDB jdb;
  protected final Transaction txn;
  protected final ReadOptions read_options;

  /**
   * @param txn the write transaction, null for a snapshot view
   */
  public RocksDBTx(JRocksDB jdb, Transaction txn, ReadOptions read_options, boolean read_only)
  {
    super(read_only);
    this.jdb = jdb;
    this.txn = txn;
    this.read_options = read_options;
  }

  @Override
  public DBBucket getBucket(String name)
  {
    ColumnFamilyHandle h = jdb.getHandle(name);
    if (h == null) return null;

    return new RocksDBBucket(this, name, h);
  }

}
