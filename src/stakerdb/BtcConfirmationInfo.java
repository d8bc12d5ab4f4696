package stakerdb;

import java.util.Objects;

import org.bitcoinj.core.Sha256Hash;

/**
 * Where a transaction was confirmed on the bitcoin chain.
 */
public class BtcConfirmationInfo
{
  private final int height;
  private final Sha256Hash block_hash;

  public BtcConfirmationInfo(int height, Sha256Hash block_hash)
  {
    if (height < 0) throw new IllegalArgumentException("Negative block height: " + height);
    this.height = height;
    this.block_hash = Objects.requireNonNull(block_hash, "block_hash");
  }

  public int getHeight(){ return height; }
  public Sha256Hash getBlockHash(){ return block_hash; }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof BtcConfirmationInfo)) return false;
    BtcConfirmationInfo other = (BtcConfirmationInfo) o;
    return height == other.height && block_hash.equals(other.block_hash);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(height, block_hash);
  }

  @Override
  public String toString()
  {
    return "" + height + ":" + block_hash;
  }
}
