package stakerdb;

import java.util.List;
import java.util.Objects;

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Transaction;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;

/**
 * Unbonding request attached to a tracked staking transaction.
 */
public class UnbondingStoreData
{
  private final ByteString unbonding_tx;
  private final int unbonding_time;
  private final ImmutableList<CovenantSignature> covenant_signatures;
  private final BtcConfirmationInfo unbonding_confirmation;

  /**
   * @param unbonding_confirmation null until the unbonding transaction is confirmed
   */
  public UnbondingStoreData(ByteString unbonding_tx, int unbonding_time,
    List<CovenantSignature> covenant_signatures, BtcConfirmationInfo unbonding_confirmation)
  {
    this.unbonding_tx = Objects.requireNonNull(unbonding_tx, "unbonding_tx");
    this.unbonding_time = StoredTransaction.checkLockTime(unbonding_time, "unbonding time");
    this.covenant_signatures = ImmutableList.copyOf(covenant_signatures);
    this.unbonding_confirmation = unbonding_confirmation;
  }

  /** Fresh unbonding data, no signatures and not confirmed */
  public static UnbondingStoreData initial(Transaction unbonding_tx, int unbonding_time)
  {
    if (unbonding_tx == null)
    {
      throw new IllegalArgumentException("cannot create unbonding tx data without unbonding tx");
    }
    return new UnbondingStoreData(
      ByteString.copyFrom(unbonding_tx.bitcoinSerialize()),
      unbonding_time,
      ImmutableList.<CovenantSignature>of(),
      null);
  }

  public ByteString getUnbondingTxBytes(){ return unbonding_tx; }
  public int getUnbondingTime(){ return unbonding_time; }
  public List<CovenantSignature> getCovenantSignatures(){ return covenant_signatures; }
  public BtcConfirmationInfo getUnbondingConfirmation(){ return unbonding_confirmation; }

  public Transaction getUnbondingTx(NetworkParameters params)
  {
    return new Transaction(params, unbonding_tx.toByteArray());
  }

  public boolean hasCovenantSignatures()
  {
    return !covenant_signatures.isEmpty();
  }

  public boolean isConfirmedOnBtc()
  {
    return unbonding_confirmation != null;
  }

  public UnbondingStoreData withCovenantSignatures(List<CovenantSignature> sigs)
  {
    return new UnbondingStoreData(unbonding_tx, unbonding_time, sigs, unbonding_confirmation);
  }

  public UnbondingStoreData withConfirmation(BtcConfirmationInfo conf)
  {
    return new UnbondingStoreData(unbonding_tx, unbonding_time, covenant_signatures, conf);
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof UnbondingStoreData)) return false;
    UnbondingStoreData other = (UnbondingStoreData) o;
    return unbonding_tx.equals(other.unbonding_tx)
      && unbonding_time == other.unbonding_time
      && covenant_signatures.equals(other.covenant_signatures)
      && Objects.equals(unbonding_confirmation, other.unbonding_confirmation);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(unbonding_tx, unbonding_time, covenant_signatures, unbonding_confirmation);
  }

  @Override
  public String toString()
  {
    return "Unbonding{time=" + unbonding_time
      + " sigs=" + covenant_signatures.size()
      + " confirmed=" + unbonding_confirmation + "}";
  }
}
