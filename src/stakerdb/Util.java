package stakerdb;

import java.nio.ByteBuffer;

import org.bitcoinj.core.Address;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.params.RegTestParams;
import org.bitcoinj.params.TestNet3Params;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import com.google.protobuf.ByteString;

public class Util
{

  public static NetworkParameters getNetworkParameters(Config config)
  {
    String network = config.get("network", "mainnet");

    if (network.equals("mainnet")) return MainNetParams.get();
    if (network.equals("testnet")) return TestNet3Params.get();
    if (network.equals("regtest")) return RegTestParams.get();

    throw new IllegalArgumentException("Unknown network: " + network);
  }

  /** 8 byte big endian, so keys sort in index order */
  public static ByteString uint64Key(long key)
  {
    ByteBuffer bb = ByteBuffer.allocate(8);
    bb.putLong(key);
    return ByteString.copyFrom(bb.array());
  }

  public static long uint64FromKey(ByteString key)
  {
    if (key.size() != 8)
    {
      throw new IllegalArgumentException("Expected 8 byte key, got " + key.size());
    }
    return ByteBuffer.wrap(key.toByteArray()).getLong();
  }

  /** Hash bytes in bitcoin internal (wire) order */
  public static ByteString hashKey(Sha256Hash hash)
  {
    return ByteString.copyFrom(hash.getReversedBytes());
  }

  public static Sha256Hash hashFromKey(ByteString key)
  {
    if (key.size() != 32)
    {
      throw new IllegalArgumentException("Expected 32 byte hash, got " + key.size());
    }
    return Sha256Hash.wrapReversed(key.toByteArray());
  }

  /**
   * Parses a hash in the usual hex display form.
   * @throws IllegalArgumentException on anything that isn't 64 hex characters
   */
  public static Sha256Hash parseTxHash(String hex)
  {
    if (hex == null) throw new IllegalArgumentException("Missing transaction hash");

    try
    {
      byte[] b = Hex.decodeHex(hex.trim());
      if (b.length != 32)
      {
        throw new IllegalArgumentException("Transaction hash must be 32 bytes, got " + b.length);
      }
      return Sha256Hash.wrap(b);
    }
    catch(DecoderException e)
    {
      throw new IllegalArgumentException("Invalid transaction hash: " + hex, e);
    }
  }

  public static Address parseAddress(NetworkParameters params, String address)
  {
    if (address == null) throw new IllegalArgumentException("Missing address");
    try
    {
      return Address.fromString(params, address.trim());
    }
    catch(AddressFormatException e)
    {
      throw new IllegalArgumentException("Invalid address for " + params.getId() + ": " + address, e);
    }
  }

  public static String getHexString(ByteString data)
  {
    return Hex.encodeHexString(data.toByteArray());
  }

}
