package stakerdb;

/**
 * Page request over the stored transactions, in index order.
 */
public class StoredTransactionQuery
{
  public static final long DEFAULT_LIMIT = 50L;

  private final long index_offset;
  private final long max_transactions;
  private final boolean reversed;
  private final WithdrawableFilter withdrawable_filter;

  public StoredTransactionQuery(long index_offset, long max_transactions, boolean reversed)
  {
    this(index_offset, max_transactions, reversed, null);
  }

  public StoredTransactionQuery(long index_offset, long max_transactions, boolean reversed, WithdrawableFilter withdrawable_filter)
  {
    if (index_offset < 0) throw new IllegalArgumentException("Negative offset: " + index_offset);
    if (max_transactions < 0) throw new IllegalArgumentException("Negative limit: " + max_transactions);

    this.index_offset = index_offset;
    this.max_transactions = max_transactions;
    this.reversed = reversed;
    this.withdrawable_filter = withdrawable_filter;
  }

  /** Offset 0, up to 50 transactions, ascending, no filter */
  public static StoredTransactionQuery defaultQuery()
  {
    return new StoredTransactionQuery(0L, DEFAULT_LIMIT, false);
  }

  /** Every stored transaction */
  public static StoredTransactionQuery all()
  {
    return new StoredTransactionQuery(0L, Long.MAX_VALUE, false);
  }

  /** Same page, only counting transactions withdrawable at best_height */
  public StoredTransactionQuery withdrawable(int best_height)
  {
    return new StoredTransactionQuery(index_offset, max_transactions, reversed, new WithdrawableFilter(best_height));
  }

  public long getIndexOffset(){ return index_offset; }
  public long getMaxTransactions(){ return max_transactions; }
  public boolean isReversed(){ return reversed; }

  /** null when not filtering */
  public WithdrawableFilter getWithdrawableFilter(){ return withdrawable_filter; }

  @Override
  public String toString()
  {
    String s = "offset=" + index_offset + " limit=" + max_transactions + " reversed=" + reversed;
    if (withdrawable_filter != null) s += " withdrawable_at=" + withdrawable_filter.getBestHeight();
    return s;
  }
}
