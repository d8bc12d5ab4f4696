package stakerdb;

import java.util.List;

import org.bitcoinj.core.Transaction;

import org.junit.Assert;
import org.junit.Test;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;

public class TrackedTransactionCodecTest
{
  private static StoredTransaction base()
  {
    return StoredTransaction.create(TestUtil.newTx(), 0, 1000, TestUtil.randomAddress())
      .withIndex(7L);
  }

  private static void assertRoundTrip(StoredTransaction tx)
    throws Exception
  {
    StoredTransaction decoded = TrackedTransactionCodec.decode(TrackedTransactionCodec.encode(tx));
    Assert.assertEquals(tx, decoded);
  }

  @Test
  public void testOptionalCombinations()
    throws Exception
  {
    BtcConfirmationInfo staking_conf = new BtcConfirmationInfo(100, TestUtil.randomHash());
    BtcConfirmationInfo unbonding_conf = new BtcConfirmationInfo(250, TestUtil.randomHash());
    UnbondingStoreData ud = UnbondingStoreData.initial(TestUtil.newTx(), 300);
    List<CovenantSignature> sigs = TestUtil.randomCovenantSignatures(3);

    StoredTransaction tx = base();
    assertRoundTrip(tx);
    assertRoundTrip(tx.withStakingConfirmation(staking_conf));
    assertRoundTrip(tx.withUnbondingData(ud));
    assertRoundTrip(tx.withUnbondingData(ud.withCovenantSignatures(sigs)));
    assertRoundTrip(tx.withUnbondingData(ud.withConfirmation(unbonding_conf)));

    StoredTransaction full = tx
      .withStakingConfirmation(staking_conf)
      .withUnbondingData(ud.withCovenantSignatures(sigs).withConfirmation(unbonding_conf))
      .withDelegationReference("delegation-1");
    assertRoundTrip(full);

    StoredTransaction decoded = TrackedTransactionCodec.decode(TrackedTransactionCodec.encode(full));
    Assert.assertEquals(3, decoded.getUnbondingData().getCovenantSignatures().size());
    Assert.assertEquals(sigs, decoded.getUnbondingData().getCovenantSignatures());
    Assert.assertEquals(staking_conf.getBlockHash(), decoded.getStakingConfirmation().getBlockHash());
  }

  @Test
  public void testAbsentStaysAbsent()
    throws Exception
  {
    StoredTransaction decoded = TrackedTransactionCodec.decode(TrackedTransactionCodec.encode(base()));
    Assert.assertNull(decoded.getStakingConfirmation());
    Assert.assertNull(decoded.getUnbondingData());
    Assert.assertFalse(decoded.isStakingTxConfirmedOnBtc());
    Assert.assertFalse(decoded.isUnbondingTxConfirmedOnBtc());
    Assert.assertEquals(StakingState.SENT_TO_BABYLON, decoded.getState());
  }

  @Test
  public void testTimeBounds()
    throws Exception
  {
    Transaction t = TestUtil.newTx();
    assertRoundTrip(StoredTransaction.create(t, 0, 0, TestUtil.randomAddress()));
    assertRoundTrip(StoredTransaction.create(t, 0, 65535, TestUtil.randomAddress()));

    try
    {
      StoredTransaction.create(t, 0, 65536, TestUtil.randomAddress());
      Assert.fail();
    }
    catch(IllegalArgumentException e)
    {
    }
  }

  @Test
  public void testStakingTimeTooLarge()
    throws Exception
  {
    ByteString.Output out = ByteString.newOutput();
    CodedOutputStream code_out = CodedOutputStream.newInstance(out);
    code_out.writeUInt64(1, 1L);
    code_out.writeBytes(2, ByteString.copyFrom(TestUtil.newTx().bitcoinSerialize()));
    code_out.writeString(4, "addr");
    code_out.writeUInt32(5, 65536);
    code_out.flush();

    try
    {
      TrackedTransactionCodec.decode(out.toByteString());
      Assert.fail();
    }
    catch(InvalidProtocolBufferException e)
    {
      Assert.assertTrue(e.getMessage().contains("staking time"));
    }
  }

  @Test
  public void testUnbondingTimeTooLarge()
    throws Exception
  {
    ByteString.Output ud_out = ByteString.newOutput();
    CodedOutputStream ud_code = CodedOutputStream.newInstance(ud_out);
    ud_code.writeBytes(1, ByteString.copyFrom(TestUtil.newTx().bitcoinSerialize()));
    ud_code.writeUInt32(2, 70000);
    ud_code.flush();

    ByteString encoded = TrackedTransactionCodec.encode(base());
    ByteString.Output out = ByteString.newOutput();
    CodedOutputStream code_out = CodedOutputStream.newInstance(out);
    code_out.writeBytes(7, ud_out.toByteString());
    code_out.flush();

    try
    {
      TrackedTransactionCodec.decode(encoded.concat(out.toByteString()));
      Assert.fail();
    }
    catch(InvalidProtocolBufferException e)
    {
      Assert.assertTrue(e.getMessage().contains("unbonding time"));
    }
  }

  @Test
  public void testUnknownFieldSkipped()
    throws Exception
  {
    StoredTransaction tx = base().withStakingConfirmation(new BtcConfirmationInfo(5, TestUtil.randomHash()));

    ByteString.Output out = ByteString.newOutput();
    CodedOutputStream code_out = CodedOutputStream.newInstance(out);
    code_out.writeString(12, "added later");
    code_out.writeUInt64(13, 42L);
    code_out.flush();

    ByteString data = TrackedTransactionCodec.encode(tx).concat(out.toByteString());
    Assert.assertEquals(tx, TrackedTransactionCodec.decode(data));
  }

  @Test
  public void testNewerVersionRejected()
    throws Exception
  {
    ByteString.Output out = ByteString.newOutput();
    CodedOutputStream code_out = CodedOutputStream.newInstance(out);
    code_out.writeUInt32(15, TrackedTransactionCodec.SCHEMA_VERSION + 1);
    code_out.flush();

    ByteString data = TrackedTransactionCodec.encode(base()).concat(out.toByteString());
    try
    {
      TrackedTransactionCodec.decode(data);
      Assert.fail();
    }
    catch(InvalidProtocolBufferException e)
    {
    }
  }

  @Test
  public void testBadCovenantKeyRejected()
    throws Exception
  {
    CovenantSignature good = TestUtil.randomCovenantSignature();

    // x coordinate above the field size
    byte[] bad_pk = new byte[32];
    for(int i=0; i<32; i++) bad_pk[i] = (byte) 0xff;

    ByteString.Output cs_out = ByteString.newOutput();
    CodedOutputStream cs_code = CodedOutputStream.newInstance(cs_out);
    cs_code.writeBytes(1, good.getSignature().getBytes());
    cs_code.writeBytes(2, ByteString.copyFrom(bad_pk));
    cs_code.flush();

    try
    {
      TrackedTransactionCodec.decodeCovenantSig(cs_out.toByteString());
      Assert.fail();
    }
    catch(InvalidProtocolBufferException e)
    {
    }
  }

  @Test
  public void testShortSignatureRejected()
    throws Exception
  {
    CovenantSignature good = TestUtil.randomCovenantSignature();

    ByteString.Output cs_out = ByteString.newOutput();
    CodedOutputStream cs_code = CodedOutputStream.newInstance(cs_out);
    cs_code.writeBytes(1, good.getSignature().getBytes().substring(0, 63));
    cs_code.writeBytes(2, good.getPubKey().getBytes());
    cs_code.flush();

    try
    {
      TrackedTransactionCodec.decodeCovenantSig(cs_out.toByteString());
      Assert.fail();
    }
    catch(InvalidProtocolBufferException e)
    {
    }
  }

  @Test
  public void testGarbage()
  {
    try
    {
      TrackedTransactionCodec.decode(ByteString.copyFrom(new byte[]{ (byte)0xff, (byte)0xff, (byte)0xff }));
      Assert.fail();
    }
    catch(InvalidProtocolBufferException e)
    {
    }
  }

  @Test
  public void testConfirmationHashByteOrder()
    throws Exception
  {
    BtcConfirmationInfo ci = new BtcConfirmationInfo(10, TestUtil.randomHash());
    ByteString enc = TrackedTransactionCodec.encodeConfirmation(ci);

    // field 1, 32 bytes, in internal order
    Assert.assertEquals(Util.hashKey(ci.getBlockHash()), enc.substring(2, 34));
    Assert.assertEquals(ci, TrackedTransactionCodec.decodeConfirmation(enc));
  }

}
