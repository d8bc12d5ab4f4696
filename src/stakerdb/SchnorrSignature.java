package stakerdb;

import java.math.BigInteger;

import org.bitcoinj.core.ECKey;

import com.google.protobuf.ByteString;

/**
 * 64 byte BIP-340 signature, r then s.
 */
public class SchnorrSignature
{
  public static final int SIZE = 64;

  private final ByteString bytes;

  private SchnorrSignature(ByteString bytes)
  {
    this.bytes = bytes;
  }

  /**
   * @throws IllegalArgumentException if r is not a field element or s is not below the group order
   */
  public static SchnorrSignature parse(ByteString bytes)
  {
    if (bytes == null || bytes.size() != SIZE)
    {
      throw new IllegalArgumentException("schnorr signature must be " + SIZE + " bytes");
    }

    BigInteger r = new BigInteger(1, bytes.substring(0, 32).toByteArray());
    BigInteger s = new BigInteger(1, bytes.substring(32, 64).toByteArray());

    if (r.compareTo(ECKey.CURVE.getCurve().getField().getCharacteristic()) >= 0)
    {
      throw new IllegalArgumentException("signature r is not below the field size");
    }
    if (s.compareTo(ECKey.CURVE.getN()) >= 0)
    {
      throw new IllegalArgumentException("signature s is not below the group order");
    }

    return new SchnorrSignature(bytes);
  }

  public ByteString getBytes()
  {
    return bytes;
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof SchnorrSignature)) return false;
    return bytes.equals(((SchnorrSignature) o).bytes);
  }

  @Override
  public int hashCode()
  {
    return bytes.hashCode();
  }

  @Override
  public String toString()
  {
    return Util.getHexString(bytes);
  }
}
