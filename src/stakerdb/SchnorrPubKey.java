package stakerdb;

import java.math.BigInteger;

import org.bitcoinj.core.ECKey;
import org.bouncycastle.math.ec.ECPoint;

import com.google.protobuf.ByteString;

/**
 * 32 byte x-only public key (BIP-340).
 */
public class SchnorrPubKey
{
  public static final int SIZE = 32;

  private final ByteString bytes;

  private SchnorrPubKey(ByteString bytes)
  {
    this.bytes = bytes;
  }

  /**
   * @throws IllegalArgumentException unless the bytes are the x coordinate
   * of a point on secp256k1
   */
  public static SchnorrPubKey parse(ByteString bytes)
  {
    if (bytes == null || bytes.size() != SIZE)
    {
      throw new IllegalArgumentException("x-only public key must be " + SIZE + " bytes");
    }

    BigInteger x = new BigInteger(1, bytes.toByteArray());
    BigInteger p = ECKey.CURVE.getCurve().getField().getCharacteristic();
    if (x.compareTo(p) >= 0)
    {
      throw new IllegalArgumentException("x-only public key is not below the field size");
    }

    // even y, as BIP-340 lifts x
    byte[] compressed = new byte[SIZE + 1];
    compressed[0] = 0x02;
    bytes.copyTo(compressed, 1);

    ECPoint point = ECKey.CURVE.getCurve().decodePoint(compressed);
    if (point.isInfinity() || !point.isValid())
    {
      throw new IllegalArgumentException("x-only public key is not on the curve");
    }

    return new SchnorrPubKey(bytes);
  }

  public static SchnorrPubKey fromECKey(ECKey key)
  {
    ECPoint point = key.getPubKeyPoint().normalize();
    return new SchnorrPubKey(ByteString.copyFrom(point.getAffineXCoord().getEncoded()));
  }

  public ByteString getBytes()
  {
    return bytes;
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof SchnorrPubKey)) return false;
    return bytes.equals(((SchnorrPubKey) o).bytes);
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
