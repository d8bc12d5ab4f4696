package stakerdb.db;

import stakerdb.StakerDBException;

/**
 * Work done inside a single database transaction.
 * Throwing from run() discards everything the action wrote.
 */
public interface DBAction<T>
{
  public T run(DBTx tx) throws StakerDBException;
}
