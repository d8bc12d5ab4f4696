package stakerdb;

import org.junit.Assert;
import org.junit.Test;

public class WithdrawableFilterTest
{
  private static StoredTransaction confirmedAt(int height, int lock)
  {
    return StoredTransaction.create(TestUtil.newTx(), 0, lock, TestUtil.randomAddress())
      .withStakingConfirmation(new BtcConfirmationInfo(height, TestUtil.randomHash()));
  }

  @Test
  public void testLockBoundary()
  {
    StoredTransaction tx = confirmedAt(100, 10);
    Assert.assertFalse(new WithdrawableFilter(108).isWithdrawable(tx));
    Assert.assertTrue(new WithdrawableFilter(109).isWithdrawable(tx));
    Assert.assertTrue(new WithdrawableFilter(5000).isWithdrawable(tx));
  }

  @Test
  public void testUnconfirmed()
  {
    StoredTransaction tx = StoredTransaction.create(TestUtil.newTx(), 0, 0, TestUtil.randomAddress());
    Assert.assertFalse(new WithdrawableFilter(Integer.MAX_VALUE).isWithdrawable(tx));
  }

  @Test
  public void testUnbondingNotConfirmedUsesStaking()
  {
    StoredTransaction tx = confirmedAt(100, 10)
      .withUnbondingData(UnbondingStoreData.initial(TestUtil.newTx(), 500));

    Assert.assertTrue(new WithdrawableFilter(109).isWithdrawable(tx));
  }

  @Test
  public void testUnbondingConfirmedUsesUnbonding()
  {
    UnbondingStoreData ud = UnbondingStoreData.initial(TestUtil.newTx(), 20)
      .withConfirmation(new BtcConfirmationInfo(150, TestUtil.randomHash()));
    StoredTransaction tx = confirmedAt(100, 10).withUnbondingData(ud);

    Assert.assertFalse(new WithdrawableFilter(168).isWithdrawable(tx));
    Assert.assertTrue(new WithdrawableFilter(169).isWithdrawable(tx));
  }

  @Test
  public void testNoOverflow()
  {
    Assert.assertTrue(WithdrawableFilter.isTimeLockExpired(0, 65535, Integer.MAX_VALUE));
    Assert.assertFalse(WithdrawableFilter.isTimeLockExpired(Integer.MAX_VALUE, 65535, Integer.MAX_VALUE));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeHeight()
  {
    new WithdrawableFilter(-1);
  }

}
