package stakerdb;

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;

import org.json.JSONObject;

/**
 * What a user wants to see about one tracked transaction.
 */
public class StakingDetails
{
  private final Sha256Hash staking_tx_hash;
  private final String staker_address;
  private final StakingState state;
  private final long index;
  private final int staking_time;
  private final int confirmation_height;

  public StakingDetails(StoredTransaction tx, NetworkParameters params)
  {
    staking_tx_hash = tx.getStakingTxHash(params);
    staker_address = tx.getStakerAddress();
    state = tx.getState();
    index = tx.getIndex();
    staking_time = tx.getStakingTime();

    if (tx.isStakingTxConfirmedOnBtc())
    {
      confirmation_height = tx.getStakingConfirmation().getHeight();
    }
    else
    {
      confirmation_height = -1;
    }
  }

  public Sha256Hash getStakingTxHash(){ return staking_tx_hash; }
  public String getStakerAddress(){ return staker_address; }
  public StakingState getState(){ return state; }
  public long getIndex(){ return index; }
  public int getStakingTime(){ return staking_time; }

  /** -1 when not confirmed */
  public int getConfirmationHeight(){ return confirmation_height; }

  public JSONObject toJSON()
  {
    JSONObject o = new JSONObject();
    o.put("staking_tx_hash", staking_tx_hash.toString());
    o.put("staker_address", staker_address);
    o.put("staking_state", state.toString());
    o.put("transaction_idx", index);
    o.put("staking_time", staking_time);
    if (confirmation_height >= 0)
    {
      o.put("confirmation_height", confirmation_height);
    }
    else
    {
      o.put("confirmation_height", JSONObject.NULL);
    }
    return o;
  }

  @Override
  public String toString()
  {
    return toJSON().toString();
  }
}
