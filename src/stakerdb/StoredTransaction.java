package stakerdb;

import java.util.Objects;

import org.bitcoinj.core.Address;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;

import com.google.protobuf.ByteString;

/**
 * One tracked staking attempt, as stored.
 * The bitcoin transactions are kept as their serialized bytes and
 * parsed again whenever they are asked for.
 */
public class StoredTransaction
{
  public static final int MAX_LOCK_TIME = 65535;

  private final long idx;
  private final ByteString staking_tx;
  private final int staking_output_index;
  private final BtcConfirmationInfo staking_confirmation;
  private final int staking_time;
  private final String staker_address;
  private final UnbondingStoreData unbonding_data;
  private final String delegation_reference;

  public StoredTransaction(
    long idx,
    ByteString staking_tx,
    int staking_output_index,
    BtcConfirmationInfo staking_confirmation,
    int staking_time,
    String staker_address,
    UnbondingStoreData unbonding_data,
    String delegation_reference)
  {
    if (idx < 0) throw new IllegalArgumentException("Negative index: " + idx);
    this.idx = idx;
    this.staking_tx = Objects.requireNonNull(staking_tx, "staking_tx");
    this.staking_output_index = staking_output_index;
    this.staking_confirmation = staking_confirmation;
    this.staking_time = checkLockTime(staking_time, "staking time");
    this.staker_address = Objects.requireNonNull(staker_address, "staker_address");
    this.unbonding_data = unbonding_data;
    this.delegation_reference = delegation_reference == null ? "" : delegation_reference;
  }

  /**
   * A record that has not been stored yet, index 0 and nothing confirmed.
   */
  public static StoredTransaction create(
    Transaction staking_tx,
    int staking_output_index,
    int staking_time,
    Address staker_address)
  {
    if (staking_tx == null) throw new IllegalArgumentException("Missing staking transaction");
    if (staker_address == null) throw new IllegalArgumentException("Missing staker address");
    if (staking_output_index < 0)
    {
      throw new IllegalArgumentException("Negative staking output index: " + staking_output_index);
    }

    return new StoredTransaction(
      0L,
      ByteString.copyFrom(staking_tx.bitcoinSerialize()),
      staking_output_index,
      null,
      staking_time,
      staker_address.toString(),
      null,
      "");
  }

  static int checkLockTime(int t, String what)
  {
    if (t < 0 || t > MAX_LOCK_TIME)
    {
      throw new IllegalArgumentException(what + " must be in 0.." + MAX_LOCK_TIME + ", got " + t);
    }
    return t;
  }

  public long getIndex(){ return idx; }
  public ByteString getStakingTxBytes(){ return staking_tx; }
  public int getStakingOutputIndex(){ return staking_output_index; }
  public BtcConfirmationInfo getStakingConfirmation(){ return staking_confirmation; }
  public int getStakingTime(){ return staking_time; }
  public String getStakerAddress(){ return staker_address; }
  public UnbondingStoreData getUnbondingData(){ return unbonding_data; }
  public String getDelegationReference(){ return delegation_reference; }

  /** A fresh copy each call, changing it does not touch the record */
  public Transaction getStakingTx(NetworkParameters params)
  {
    return new Transaction(params, staking_tx.toByteArray());
  }

  public Sha256Hash getStakingTxHash(NetworkParameters params)
  {
    return getStakingTx(params).getTxId();
  }

  /** True only if the staking transaction was confirmed on bitcoin */
  public boolean isStakingTxConfirmedOnBtc()
  {
    return staking_confirmation != null;
  }

  /** True only if there is unbonding data and its transaction was confirmed on bitcoin */
  public boolean isUnbondingTxConfirmedOnBtc()
  {
    if (unbonding_data == null) return false;
    return unbonding_data.isConfirmedOnBtc();
  }

  public StakingState getState()
  {
    return StakingState.of(this);
  }

  public StoredTransaction withIndex(long new_idx)
  {
    return new StoredTransaction(new_idx, staking_tx, staking_output_index, staking_confirmation,
      staking_time, staker_address, unbonding_data, delegation_reference);
  }

  public StoredTransaction withStakingConfirmation(BtcConfirmationInfo conf)
  {
    return new StoredTransaction(idx, staking_tx, staking_output_index, conf,
      staking_time, staker_address, unbonding_data, delegation_reference);
  }

  public StoredTransaction withUnbondingData(UnbondingStoreData ud)
  {
    return new StoredTransaction(idx, staking_tx, staking_output_index, staking_confirmation,
      staking_time, staker_address, ud, delegation_reference);
  }

  public StoredTransaction withDelegationReference(String ref)
  {
    return new StoredTransaction(idx, staking_tx, staking_output_index, staking_confirmation,
      staking_time, staker_address, unbonding_data, ref);
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof StoredTransaction)) return false;
    StoredTransaction other = (StoredTransaction) o;
    return idx == other.idx
      && staking_tx.equals(other.staking_tx)
      && staking_output_index == other.staking_output_index
      && Objects.equals(staking_confirmation, other.staking_confirmation)
      && staking_time == other.staking_time
      && staker_address.equals(other.staker_address)
      && Objects.equals(unbonding_data, other.unbonding_data)
      && delegation_reference.equals(other.delegation_reference);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(idx, staking_tx, staking_output_index, staking_confirmation,
      staking_time, staker_address, unbonding_data, delegation_reference);
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    sb.append("StoredTransaction " + idx); sb.append('\n');
    sb.append("  staking output: " + staking_output_index + " time: " + staking_time); sb.append('\n');
    sb.append("  staker: " + staker_address); sb.append('\n');
    sb.append("  confirmed: " + staking_confirmation); sb.append('\n');
    sb.append("  unbonding: " + unbonding_data); sb.append('\n');
    sb.append("  delegation: " + delegation_reference); sb.append('\n');
    return sb.toString();
  }

}
