package stakerdb;

/**
 * Every failure condition the transaction store reports to its callers.
 */
public enum StoreError
{
  /** A record for this staking transaction hash already exists */
  DUPLICATE_TRANSACTION,

  /** No record is indexed under the requested hash */
  TRANSACTION_NOT_FOUND,

  /**
   * The stored data is inconsistent or can't be decoded.
   * Never caused by correct use of the store.
   */
  CORRUPTED_STORE,

  /** The record has no unbonding data to update */
  UNBONDING_DATA_NOT_FOUND,

  /** Covenant signatures were already recorded for this unbonding */
  UNBONDING_ALREADY_SET;

  public boolean isCorruption()
  {
    return this == CORRUPTED_STORE;
  }
}
