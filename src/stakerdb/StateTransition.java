package stakerdb;

import java.util.List;

import org.bitcoinj.core.Sha256Hash;

import com.google.common.collect.ImmutableList;

/**
 * The fixed set of updates that can be applied to a stored transaction.
 */
public final class StateTransition
{
  public enum Type
  {
    STAKING_CONFIRMED,
    DELEGATION_ACTIVE_AND_CONFIRMED,
    UNBONDING_SIGNATURES_RECEIVED,
    UNBONDING_CONFIRMED
  }

  private final Type type;
  private final BtcConfirmationInfo confirmation;
  private final ImmutableList<CovenantSignature> signatures;

  private StateTransition(Type type, BtcConfirmationInfo confirmation, List<CovenantSignature> signatures)
  {
    this.type = type;
    this.confirmation = confirmation;
    this.signatures = signatures == null ? null : ImmutableList.copyOf(signatures);
  }

  public static StateTransition stakingConfirmed(int height, Sha256Hash block_hash)
  {
    return new StateTransition(Type.STAKING_CONFIRMED, new BtcConfirmationInfo(height, block_hash), null);
  }

  public static StateTransition delegationActiveAndConfirmed(int height, Sha256Hash block_hash)
  {
    return new StateTransition(Type.DELEGATION_ACTIVE_AND_CONFIRMED, new BtcConfirmationInfo(height, block_hash), null);
  }

  /**
   * @throws IllegalArgumentException if there are no signatures
   */
  public static StateTransition unbondingSignaturesReceived(List<CovenantSignature> signatures)
  {
    if (signatures == null || signatures.isEmpty())
    {
      throw new IllegalArgumentException("cannot set unbonding signatures received without signatures");
    }
    return new StateTransition(Type.UNBONDING_SIGNATURES_RECEIVED, null, signatures);
  }

  public static StateTransition unbondingConfirmed(int height, Sha256Hash block_hash)
  {
    return new StateTransition(Type.UNBONDING_CONFIRMED, new BtcConfirmationInfo(height, block_hash), null);
  }

  /**
   * @return the updated record, the argument is left alone
   * @throws StakerDBException if the transition does not apply to this record
   */
  public StoredTransaction apply(StoredTransaction tx)
    throws StakerDBException
  {
    switch(type)
    {
      case STAKING_CONFIRMED:
      case DELEGATION_ACTIVE_AND_CONFIRMED:
        return tx.withStakingConfirmation(confirmation);

      case UNBONDING_SIGNATURES_RECEIVED:
        if (tx.getUnbondingData() == null)
        {
          throw new StakerDBException(StoreError.UNBONDING_DATA_NOT_FOUND,
            "cannot set unbonding signatures received, because unbonding tx data does not exist");
        }
        if (tx.getUnbondingData().hasCovenantSignatures())
        {
          throw new StakerDBException(StoreError.UNBONDING_ALREADY_SET,
            "cannot set unbonding signatures received, because unbonding signatures already exist");
        }
        return tx.withUnbondingData(tx.getUnbondingData().withCovenantSignatures(signatures));

      case UNBONDING_CONFIRMED:
        if (tx.getUnbondingData() == null)
        {
          throw new StakerDBException(StoreError.UNBONDING_DATA_NOT_FOUND,
            "cannot set unbonding confirmed on btc, because unbonding tx data does not exist");
        }
        return tx.withUnbondingData(tx.getUnbondingData().withConfirmation(confirmation));

      default:
        throw new IllegalStateException("Unknown transition " + type);
    }
  }

  @Override
  public String toString()
  {
    if (confirmation != null) return type + " " + confirmation;
    return type + " " + signatures.size() + " signatures";
  }

}
