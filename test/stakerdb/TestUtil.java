package stakerdb;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.Random;

import org.bitcoinj.core.Address;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.LegacyAddress;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutPoint;
import org.bitcoinj.core.Utils;
import org.bitcoinj.params.RegTestParams;

import org.junit.Test;

import com.google.protobuf.ByteString;

import stakerdb.db.memory.MemoryDB;

public class TestUtil
{
  private static final Random rnd = new Random();

  @Test
  public void testNothing()
  {

  }

  public static NetworkParameters params()
  {
    return RegTestParams.get();
  }

  public static Config memoryConfig()
  {
    Properties p = new Properties();
    p.setProperty("db_type", "memory");
    p.setProperty("network", "regtest");
    return new Config(p);
  }

  public static EventLog testLog()
  {
    return new EventLog(System.out);
  }

  public static TrackedTransactionStore newMemoryStore()
  {
    return new TrackedTransactionStore(new MemoryDB(memoryConfig(), testLog()), testLog());
  }

  public static Sha256Hash randomHash()
  {
    byte[] b = new byte[32];
    rnd.nextBytes(b);
    return Sha256Hash.wrap(b);
  }

  public static ByteString randomByteString(int sz)
  {
    byte[] b = new byte[sz];
    rnd.nextBytes(b);
    return ByteString.copyFrom(b);
  }

  public static Address randomAddress()
  {
    return LegacyAddress.fromKey(params(), new ECKey());
  }

  public static TransactionOutPoint randomOutPoint()
  {
    return new TransactionOutPoint(params(), rnd.nextInt(8), randomHash());
  }

  /**
   * A transaction spending the given outpoints with one output.
   * Random outpoints make the hash unique.
   */
  public static Transaction newTx(List<TransactionOutPoint> spends)
  {
    NetworkParameters params = params();
    Transaction tx = new Transaction(params);
    for(TransactionOutPoint op : spends)
    {
      tx.addInput(new TransactionInput(params, tx, new byte[0], op));
    }
    tx.addOutput(Coin.valueOf(100000L), randomAddress());
    return tx;
  }

  public static Transaction newTx()
  {
    List<TransactionOutPoint> spends = new ArrayList<>();
    spends.add(randomOutPoint());
    return newTx(spends);
  }

  public static CovenantSignature randomCovenantSignature()
  {
    ECKey key = new ECKey();
    ECKey.ECDSASignature sig = key.sign(randomHash());

    byte[] b = new byte[64];
    System.arraycopy(Utils.bigIntegerToBytes(sig.r, 32), 0, b, 0, 32);
    System.arraycopy(Utils.bigIntegerToBytes(sig.s, 32), 0, b, 32, 32);

    return new CovenantSignature(SchnorrPubKey.fromECKey(key), SchnorrSignature.parse(ByteString.copyFrom(b)));
  }

  public static List<CovenantSignature> randomCovenantSignatures(int n)
  {
    ArrayList<CovenantSignature> lst = new ArrayList<>();
    for(int i=0; i<n; i++)
    {
      lst.add(randomCovenantSignature());
    }
    return lst;
  }

  /** Field prime of secp256k1 */
  public static BigInteger fieldSize()
  {
    return ECKey.CURVE.getCurve().getField().getCharacteristic();
  }

}
