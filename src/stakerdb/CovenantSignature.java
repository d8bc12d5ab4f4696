package stakerdb;

import java.util.Objects;

/**
 * A covenant committee member's signature on an unbonding transaction,
 * with the key it was made with.
 */
public class CovenantSignature
{
  private final SchnorrPubKey pub_key;
  private final SchnorrSignature signature;

  public CovenantSignature(SchnorrPubKey pub_key, SchnorrSignature signature)
  {
    this.pub_key = Objects.requireNonNull(pub_key, "pub_key");
    this.signature = Objects.requireNonNull(signature, "signature");
  }

  public SchnorrPubKey getPubKey(){ return pub_key; }
  public SchnorrSignature getSignature(){ return signature; }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof CovenantSignature)) return false;
    CovenantSignature other = (CovenantSignature) o;
    return pub_key.equals(other.pub_key) && signature.equals(other.signature);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(pub_key, signature);
  }

  @Override
  public String toString()
  {
    return pub_key + ":" + signature;
  }
}
