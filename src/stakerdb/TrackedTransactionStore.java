package stakerdb;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.bitcoinj.core.Address;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutPoint;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;

import stakerdb.db.DB;
import stakerdb.db.DBAction;
import stakerdb.db.DBBucket;
import stakerdb.db.DBCursor;
import stakerdb.db.DBTx;

/**
 * Persistent record of every staking transaction the client submitted.
 *
 * Layout:
 * <ul>
 *   <li>transactions: 8 byte big endian index to encoded record</li>
 *   <li>transactionIdx: 32 byte tx hash to 8 byte index, plus the next index counter under "ntk"</li>
 *   <li>inputs: 36 byte outpoint (hash + big endian output index) to the hash of the tx that spent it</li>
 * </ul>
 * Indexes start at 1 and are never reused.  Records are never deleted.
 */
public class TrackedTransactionStore
{
  public static final String TRANSACTION_BUCKET = "transactions";
  public static final String TRANSACTION_INDEX_BUCKET = "transactionIdx";
  public static final String INPUTS_BUCKET = "inputs";

  public static final ByteString NUM_TX_KEY = ByteString.copyFromUtf8("ntk");

  /**
   * Called for each record by scanTrackedTransactions().
   * Throwing stops the scan.
   */
  public interface ScanVisitor
  {
    public void visit(StoredTransaction tx) throws StakerDBException;
  }

  private final DB db;
  private final EventLog log;

  /**
   * Creates the buckets if they don't exist yet.
   */
  public TrackedTransactionStore(DB db, EventLog log)
  {
    this.db = db;
    this.log = log;

    db.openBucket(TRANSACTION_BUCKET);
    db.openBucket(TRANSACTION_INDEX_BUCKET);
    db.openBucket(INPUTS_BUCKET);
  }

  public DB getDB()
  {
    return db;
  }

  private static DBBucket requireBucket(DBTx tx, String name)
    throws StakerDBException
  {
    DBBucket b = tx.getBucket(name);
    if (b == null)
    {
      throw new StakerDBException(StoreError.CORRUPTED_STORE, "Missing bucket " + name);
    }
    return b;
  }

  private static long nextTxKey(DBBucket tx_idx_bucket)
    throws StakerDBException
  {
    ByteString num = tx_idx_bucket.get(NUM_TX_KEY);
    if (num == null) return 1L;

    if (num.size() != 8)
    {
      throw new StakerDBException(StoreError.CORRUPTED_STORE, "Bad transaction counter length " + num.size());
    }
    return Util.uint64FromKey(num);
  }

  /** The counter always holds the next index to use, so this is one less */
  private static long getNumTx(DBBucket tx_idx_bucket)
    throws StakerDBException
  {
    return nextTxKey(tx_idx_bucket) - 1L;
  }

  public static ByteString outpointKey(TransactionOutPoint op)
  {
    ByteBuffer bb = ByteBuffer.allocate(36);
    bb.put(op.getHash().getReversedBytes());
    bb.putInt((int) op.getIndex());
    return ByteString.copyFrom(bb.array());
  }

  private static StoredTransaction decodeStored(ByteString data)
    throws StakerDBException
  {
    try
    {
      return TrackedTransactionCodec.decode(data);
    }
    catch(InvalidProtocolBufferException e)
    {
      throw new StakerDBException(StoreError.CORRUPTED_STORE, "Unable to decode stored transaction", e);
    }
  }

  /** @return key into the transaction bucket */
  private static ByteString lookupKey(ByteString tx_hash_key, DBBucket tx_idx_bucket, DBBucket tx_bucket)
    throws StakerDBException
  {
    ByteString tx_key = tx_idx_bucket.get(tx_hash_key);
    if (tx_key == null)
    {
      throw new StakerDBException(StoreError.TRANSACTION_NOT_FOUND,
        "No transaction " + Util.hashFromKey(tx_hash_key));
    }
    if (!tx_bucket.containsKey(tx_key))
    {
      // index without the record means something weird happened
      throw new StakerDBException(StoreError.CORRUPTED_STORE,
        "Index entry for " + Util.hashFromKey(tx_hash_key) + " has no transaction");
    }
    return tx_key;
  }

  /**
   * Stores a staking transaction with no unbonding data.
   * @return the index assigned
   */
  public long addTransaction(
    Transaction staking_tx,
    int staking_output_index,
    int staking_time,
    Address staker_address,
    String delegation_reference)
    throws StakerDBException
  {
    return addTransactionInternal(
      StoredTransaction.create(staking_tx, staking_output_index, staking_time, staker_address)
        .withDelegationReference(delegation_reference),
      staking_tx);
  }

  /**
   * Stores a staking transaction that has been submitted as a delegation
   * along with its unbonding transaction.
   * @return the index assigned
   */
  public long addTransactionSentToBabylon(
    Transaction staking_tx,
    int staking_output_index,
    int staking_time,
    Address staker_address,
    Transaction unbonding_tx,
    int unbonding_time,
    String delegation_reference)
    throws StakerDBException
  {
    UnbondingStoreData ud = UnbondingStoreData.initial(unbonding_tx, unbonding_time);

    return addTransactionInternal(
      StoredTransaction.create(staking_tx, staking_output_index, staking_time, staker_address)
        .withUnbondingData(ud)
        .withDelegationReference(delegation_reference),
      staking_tx);
  }

  private long addTransactionInternal(final StoredTransaction record, Transaction staking_tx)
    throws StakerDBException
  {
    long t1 = System.nanoTime();

    final Sha256Hash tx_hash = staking_tx.getTxId();
    final ByteString tx_hash_key = Util.hashKey(tx_hash);

    final List<ByteString> inputs = new ArrayList<>();
    for(TransactionInput in : staking_tx.getInputs())
    {
      inputs.add(outpointKey(in.getOutpoint()));
    }

    long idx = db.update(new DBAction<Long>()
    {
      public Long run(DBTx tx)
        throws StakerDBException
      {
        DBBucket tx_idx_bucket = requireBucket(tx, TRANSACTION_INDEX_BUCKET);

        // check index first to avoid duplicates
        if (tx_idx_bucket.containsKey(tx_hash_key))
        {
          throw new StakerDBException(StoreError.DUPLICATE_TRANSACTION, "Transaction " + tx_hash + " already stored");
        }

        DBBucket tx_bucket = requireBucket(tx, TRANSACTION_BUCKET);
        DBBucket inputs_bucket = requireBucket(tx, INPUTS_BUCKET);

        long next = nextTxKey(tx_idx_bucket);
        ByteString next_key = Util.uint64Key(next);

        tx_bucket.put(next_key, TrackedTransactionCodec.encode(record.withIndex(next)));
        tx_idx_bucket.put(tx_hash_key, next_key);

        for(ByteString in : inputs)
        {
          inputs_bucket.put(in, tx_hash_key);
        }

        tx_idx_bucket.put(NUM_TX_KEY, Util.uint64Key(next + 1L));

        return next;
      }
    });

    TimeRecord.record(t1, "store_insert");
    log.log("Stored transaction " + tx_hash + " as " + idx + " with " + inputs.size() + " inputs");
    return idx;
  }

  /**
   * @throws StakerDBException TRANSACTION_NOT_FOUND if the hash is unknown,
   *   CORRUPTED_STORE if the stored data is inconsistent
   */
  public StoredTransaction getTransaction(Sha256Hash tx_hash)
    throws StakerDBException
  {
    long t1 = System.nanoTime();
    final ByteString tx_hash_key = Util.hashKey(tx_hash);

    try
    {
      return db.view(new DBAction<StoredTransaction>()
      {
        public StoredTransaction run(DBTx tx)
          throws StakerDBException
        {
          DBBucket tx_idx_bucket = requireBucket(tx, TRANSACTION_INDEX_BUCKET);
          DBBucket tx_bucket = requireBucket(tx, TRANSACTION_BUCKET);

          ByteString tx_key = lookupKey(tx_hash_key, tx_idx_bucket, tx_bucket);
          return decodeStored(tx_bucket.get(tx_key));
        }
      });
    }
    catch(StakerDBException e)
    {
      if (e.getError().isCorruption()) log.logTrace(e);
      throw e;
    }
    finally
    {
      TimeRecord.record(t1, "store_get");
    }
  }

  /**
   * Reads, transforms and rewrites the record in one update.
   * If the transition fails nothing is written.
   */
  public void applyTransition(Sha256Hash tx_hash, final StateTransition transition)
    throws StakerDBException
  {
    long t1 = System.nanoTime();
    final ByteString tx_hash_key = Util.hashKey(tx_hash);

    try
    {
      db.update(new DBAction<Void>()
      {
        public Void run(DBTx tx)
          throws StakerDBException
        {
          DBBucket tx_idx_bucket = requireBucket(tx, TRANSACTION_INDEX_BUCKET);
          DBBucket tx_bucket = requireBucket(tx, TRANSACTION_BUCKET);

          ByteString tx_key = lookupKey(tx_hash_key, tx_idx_bucket, tx_bucket);
          StoredTransaction stored = decodeStored(tx_bucket.get(tx_key));

          StoredTransaction updated = transition.apply(stored);

          tx_bucket.put(tx_key, TrackedTransactionCodec.encode(updated));
          return null;
        }
      });
    }
    catch(StakerDBException e)
    {
      if (e.getError().isCorruption()) log.logTrace(e);
      throw e;
    }
    finally
    {
      TimeRecord.record(t1, "store_transition");
    }

    log.log("Applied " + transition + " to " + tx_hash);
  }

  public void setTxConfirmed(Sha256Hash tx_hash, Sha256Hash block_hash, int block_height)
    throws StakerDBException
  {
    applyTransition(tx_hash, StateTransition.stakingConfirmed(block_height, block_hash));
  }

  public void setDelegationActiveOnBabylonAndConfirmedOnBtc(Sha256Hash tx_hash, Sha256Hash block_hash, int block_height)
    throws StakerDBException
  {
    applyTransition(tx_hash, StateTransition.delegationActiveAndConfirmed(block_height, block_hash));
  }

  public void setTxUnbondingSignaturesReceived(Sha256Hash tx_hash, List<CovenantSignature> covenant_signatures)
    throws StakerDBException
  {
    applyTransition(tx_hash, StateTransition.unbondingSignaturesReceived(covenant_signatures));
  }

  public void setTxUnbondingConfirmedOnBtc(Sha256Hash tx_hash, Sha256Hash block_hash, int block_height)
    throws StakerDBException
  {
    applyTransition(tx_hash, StateTransition.unbondingConfirmed(block_height, block_hash));
  }

  public StoredTransactionQueryResult queryStoredTransactions(final StoredTransactionQuery q)
    throws StakerDBException
  {
    long t1 = System.nanoTime();
    try
    {
      return db.view(new DBAction<StoredTransactionQueryResult>()
      {
        public StoredTransactionQueryResult run(DBTx tx)
          throws StakerDBException
        {
          DBBucket tx_bucket = requireBucket(tx, TRANSACTION_BUCKET);
          DBBucket tx_idx_bucket = requireBucket(tx, TRANSACTION_INDEX_BUCKET);

          long num_transactions = getNumTx(tx_idx_bucket);
          if (num_transactions == 0) return StoredTransactionQueryResult.empty(q.isReversed());

          final WithdrawableFilter filter = q.getWithdrawableFilter();
          final ArrayList<StoredTransaction> page = new ArrayList<>();

          try(DBCursor cursor = tx_bucket.newCursor())
          {
            Paginator paginator = new Paginator(cursor, q.isReversed(), q.getIndexOffset(), q.getMaxTransactions());

            paginator.query(new Paginator.Accumulator()
            {
              public boolean accept(ByteString key, ByteString value)
                throws StakerDBException
              {
                StoredTransaction stored = decodeStored(value);

                if (filter != null && !filter.isWithdrawable(stored)) return false;

                page.add(stored);
                return true;
              }
            });
          }

          if (q.isReversed())
          {
            Collections.reverse(page);
          }

          return new StoredTransactionQueryResult(page, num_transactions, q.isReversed());
        }
      });
    }
    finally
    {
      TimeRecord.record(t1, "store_query");
    }
  }

  public List<StoredTransaction> getAllStoredTransactions()
    throws StakerDBException
  {
    return queryStoredTransactions(StoredTransactionQuery.all()).getTransactions();
  }

  /**
   * Visits every record in index order.  The first exception thrown by the
   * visitor stops the scan and is rethrown.
   */
  public void scanTrackedTransactions(final ScanVisitor visitor)
    throws StakerDBException
  {
    long t1 = System.nanoTime();
    try
    {
      db.view(new DBAction<Void>()
      {
        public Void run(DBTx tx)
          throws StakerDBException
        {
          DBBucket tx_bucket = requireBucket(tx, TRANSACTION_BUCKET);

          try(DBCursor cursor = tx_bucket.newCursor())
          {
            for(Map.Entry<ByteString, ByteString> e = cursor.first(); e != null; e = cursor.next())
            {
              visitor.visit(decodeStored(e.getValue()));
            }
          }
          return null;
        }
      });
    }
    finally
    {
      TimeRecord.record(t1, "store_scan");
    }
  }

  /**
   * @return true if any stored staking transaction spends this outpoint
   */
  public boolean outpointUsed(TransactionOutPoint op)
    throws StakerDBException
  {
    final ByteString key = outpointKey(op);

    return db.view(new DBAction<Boolean>()
    {
      public Boolean run(DBTx tx)
        throws StakerDBException
      {
        return requireBucket(tx, INPUTS_BUCKET).containsKey(key);
      }
    });
  }

  /**
   * @return the hash of the stored staking transaction spending this outpoint, or null
   */
  public Sha256Hash getOutpointSpender(TransactionOutPoint op)
    throws StakerDBException
  {
    final ByteString key = outpointKey(op);

    return db.view(new DBAction<Sha256Hash>()
    {
      public Sha256Hash run(DBTx tx)
        throws StakerDBException
      {
        ByteString v = requireBucket(tx, INPUTS_BUCKET).get(key);
        if (v == null) return null;
        if (v.size() != 32)
        {
          throw new StakerDBException(StoreError.CORRUPTED_STORE, "Bad outpoint entry length " + v.size());
        }
        return Util.hashFromKey(v);
      }
    });
  }

  /** Number of stored transactions */
  public long getTransactionCount()
    throws StakerDBException
  {
    return db.view(new DBAction<Long>()
    {
      public Long run(DBTx tx)
        throws StakerDBException
      {
        return getNumTx(requireBucket(tx, TRANSACTION_INDEX_BUCKET));
      }
    });
  }

}
