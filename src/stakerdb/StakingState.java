package stakerdb;

/**
 * Lifecycle position of a tracked transaction, derived from what has been recorded on it.
 */
public enum StakingState
{
  SENT_TO_BABYLON,
  CONFIRMED_ON_BTC,
  UNBONDING_SIGNATURES_RECEIVED,
  UNBONDING_CONFIRMED_ON_BTC;

  public static StakingState of(StoredTransaction tx)
  {
    UnbondingStoreData ud = tx.getUnbondingData();
    if (ud != null && ud.isConfirmedOnBtc()) return UNBONDING_CONFIRMED_ON_BTC;
    if (ud != null && ud.hasCovenantSignatures()) return UNBONDING_SIGNATURES_RECEIVED;
    if (tx.isStakingTxConfirmedOnBtc()) return CONFIRMED_ON_BTC;
    return SENT_TO_BABYLON;
  }
}
