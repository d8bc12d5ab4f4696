package stakerdb;

/**
 * Decides if a tracked transaction's funds can be withdrawn at a given chain height.
 */
public class WithdrawableFilter
{
  private final int best_height;

  public WithdrawableFilter(int best_height)
  {
    if (best_height < 0) throw new IllegalArgumentException("Negative best height: " + best_height);
    this.best_height = best_height;
  }

  public int getBestHeight()
  {
    return best_height;
  }

  public boolean isWithdrawable(StoredTransaction tx)
  {
    if (!tx.isStakingTxConfirmedOnBtc()) return false;

    if (tx.isUnbondingTxConfirmedOnBtc())
    {
      UnbondingStoreData ud = tx.getUnbondingData();
      return isTimeLockExpired(ud.getUnbondingConfirmation().getHeight(), ud.getUnbondingTime(), best_height);
    }

    return isTimeLockExpired(tx.getStakingConfirmation().getHeight(), tx.getStakingTime(), best_height);
  }

  /**
   * A transaction can only be included in the next block, so the lock is
   * checked against best_height + 1.
   */
  public static boolean isTimeLockExpired(long confirmation_height, int lock_time, long best_height)
  {
    long next_block_height = best_height + 1L;
    long past_lock = next_block_height - confirmation_height - lock_time;
    return past_lock >= 0;
  }

}
