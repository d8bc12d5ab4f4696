package stakerdb;

import java.util.List;

import com.google.common.collect.ImmutableList;

public class StoredTransactionQueryResult
{
  private final ImmutableList<StoredTransaction> transactions;
  private final long total;
  private final boolean reversed;

  public StoredTransactionQueryResult(List<StoredTransaction> transactions, long total, boolean reversed)
  {
    this.transactions = ImmutableList.copyOf(transactions);
    this.total = total;
    this.reversed = reversed;
  }

  public static StoredTransactionQueryResult empty(boolean reversed)
  {
    return new StoredTransactionQueryResult(ImmutableList.<StoredTransaction>of(), 0L, reversed);
  }

  /** In ascending index order regardless of scan direction */
  public List<StoredTransaction> getTransactions(){ return transactions; }

  /** Number of stored transactions, ignoring offset, limit and filter */
  public long getTotal(){ return total; }

  public boolean isReversed(){ return reversed; }

  /**
   * False once the scan has run out of records in its direction.
   * A forward page that is not empty may still be followed by an empty one.
   */
  public boolean hasNextPage()
  {
    if (transactions.isEmpty()) return false;
    if (reversed) return transactions.get(0).getIndex() > 1L;
    return true;
  }

  /**
   * Offset for the query that continues this one in the same direction.
   * A filtered page can end well past offset + limit, so the offset comes
   * from the records actually returned.  Forward that is the highest index,
   * reversed it is one below the lowest, as a reversed query starts at its offset.
   * Only meaningful when hasNextPage() is true.
   */
  public long getNextOffset()
  {
    if (transactions.isEmpty()) return 0L;
    if (reversed) return transactions.get(0).getIndex() - 1L;
    return transactions.get(transactions.size() - 1).getIndex();
  }
}
