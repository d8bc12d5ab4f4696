package stakerdb;

import java.io.IOException;
import java.util.ArrayList;

import org.bitcoinj.core.Sha256Hash;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;

/**
 * Converts StoredTransaction records to and from the bytes kept in the
 * transactions bucket.
 *
 * The layout is protobuf wire format:
 * <pre>
 * TrackedTransaction
 *   1  tracked_transaction_idx   uint64
 *   2  staking_transaction       bytes    (bitcoin wire serialization)
 *   3  staking_output_idx        uint32
 *   4  staker_address            string
 *   5  staking_time              uint32   (must fit 16 bits)
 *   6  staking_confirmation      BTCConfirmationInfo, absent if unconfirmed
 *   7  unbonding_tx_data         UnbondingTxData, absent if none
 *   8  delegation_reference      string
 *   15 schema_version            uint32
 *
 * BTCConfirmationInfo
 *   1  block_hash                bytes    (32, internal byte order)
 *   2  block_height              uint32
 *
 * UnbondingTxData
 *   1  unbonding_transaction     bytes
 *   2  unbonding_time            uint32   (must fit 16 bits)
 *   3  covenant_signatures       repeated CovenantSig
 *   4  unbonding_confirmation    BTCConfirmationInfo, absent if unconfirmed
 *
 * CovenantSig
 *   1  covenant_sig              bytes    (64 byte schnorr signature)
 *   2  covenant_sig_btc_pk       bytes    (32 byte x-only key)
 * </pre>
 * Unknown fields are skipped so records written by a later minor revision still read.
 */
public class TrackedTransactionCodec
{
  public static final int SCHEMA_VERSION = 1;

  private static final int TT_IDX = 1;
  private static final int TT_STAKING_TX = 2;
  private static final int TT_STAKING_OUTPUT_IDX = 3;
  private static final int TT_STAKER_ADDRESS = 4;
  private static final int TT_STAKING_TIME = 5;
  private static final int TT_STAKING_CONFIRMATION = 6;
  private static final int TT_UNBONDING = 7;
  private static final int TT_DELEGATION_REF = 8;
  private static final int TT_SCHEMA_VERSION = 15;

  private static final int CI_BLOCK_HASH = 1;
  private static final int CI_BLOCK_HEIGHT = 2;

  private static final int UD_TX = 1;
  private static final int UD_TIME = 2;
  private static final int UD_COVENANT_SIGS = 3;
  private static final int UD_CONFIRMATION = 4;

  private static final int CS_SIG = 1;
  private static final int CS_PK = 2;

  public static ByteString encode(StoredTransaction tx)
  {
    try
    {
      ByteString.Output out = ByteString.newOutput(tx.getStakingTxBytes().size() + 256);
      CodedOutputStream code_out = CodedOutputStream.newInstance(out);

      code_out.writeUInt32(TT_SCHEMA_VERSION, SCHEMA_VERSION);
      code_out.writeUInt64(TT_IDX, tx.getIndex());
      code_out.writeBytes(TT_STAKING_TX, tx.getStakingTxBytes());
      code_out.writeUInt32(TT_STAKING_OUTPUT_IDX, tx.getStakingOutputIndex());
      code_out.writeString(TT_STAKER_ADDRESS, tx.getStakerAddress());
      code_out.writeUInt32(TT_STAKING_TIME, tx.getStakingTime());

      if (tx.getStakingConfirmation() != null)
      {
        code_out.writeBytes(TT_STAKING_CONFIRMATION, encodeConfirmation(tx.getStakingConfirmation()));
      }
      if (tx.getUnbondingData() != null)
      {
        code_out.writeBytes(TT_UNBONDING, encodeUnbonding(tx.getUnbondingData()));
      }
      code_out.writeString(TT_DELEGATION_REF, tx.getDelegationReference());

      code_out.flush();
      return out.toByteString();
    }
    catch(IOException e)
    {
      // only writing to memory
      throw new RuntimeException(e);
    }
  }

  public static ByteString encodeConfirmation(BtcConfirmationInfo ci)
    throws IOException
  {
    ByteString.Output out = ByteString.newOutput(48);
    CodedOutputStream code_out = CodedOutputStream.newInstance(out);

    code_out.writeBytes(CI_BLOCK_HASH, Util.hashKey(ci.getBlockHash()));
    code_out.writeUInt32(CI_BLOCK_HEIGHT, ci.getHeight());

    code_out.flush();
    return out.toByteString();
  }

  public static ByteString encodeUnbonding(UnbondingStoreData ud)
    throws IOException
  {
    ByteString.Output out = ByteString.newOutput(ud.getUnbondingTxBytes().size() + 128);
    CodedOutputStream code_out = CodedOutputStream.newInstance(out);

    code_out.writeBytes(UD_TX, ud.getUnbondingTxBytes());
    code_out.writeUInt32(UD_TIME, ud.getUnbondingTime());
    for(CovenantSignature cs : ud.getCovenantSignatures())
    {
      code_out.writeBytes(UD_COVENANT_SIGS, encodeCovenantSig(cs));
    }
    if (ud.getUnbondingConfirmation() != null)
    {
      code_out.writeBytes(UD_CONFIRMATION, encodeConfirmation(ud.getUnbondingConfirmation()));
    }

    code_out.flush();
    return out.toByteString();
  }

  public static ByteString encodeCovenantSig(CovenantSignature cs)
    throws IOException
  {
    ByteString.Output out = ByteString.newOutput(100);
    CodedOutputStream code_out = CodedOutputStream.newInstance(out);

    code_out.writeBytes(CS_SIG, cs.getSignature().getBytes());
    code_out.writeBytes(CS_PK, cs.getPubKey().getBytes());

    code_out.flush();
    return out.toByteString();
  }

  /**
   * @throws InvalidProtocolBufferException if the bytes are not a valid record
   */
  public static StoredTransaction decode(ByteString data)
    throws InvalidProtocolBufferException
  {
    CodedInputStream code_in = data.newCodedInput();

    long idx = 0L;
    ByteString staking_tx = ByteString.EMPTY;
    int staking_output_idx = 0;
    String staker_address = "";
    long staking_time = 0L;
    BtcConfirmationInfo staking_conf = null;
    UnbondingStoreData unbonding = null;
    String delegation_ref = "";

    try
    {
      while(true)
      {
        int tag = code_in.readTag();
        if (tag == 0) break;

        switch(WireFormat.getTagFieldNumber(tag))
        {
          case TT_SCHEMA_VERSION:
            expectVarint(tag);
            int version = code_in.readUInt32();
            if (version > SCHEMA_VERSION)
            {
              throw new InvalidProtocolBufferException("Record schema version " + version + " is newer than " + SCHEMA_VERSION);
            }
            break;
          case TT_IDX:
            expectVarint(tag);
            idx = code_in.readUInt64();
            break;
          case TT_STAKING_TX:
            expectBytes(tag);
            staking_tx = code_in.readBytes();
            break;
          case TT_STAKING_OUTPUT_IDX:
            expectVarint(tag);
            staking_output_idx = code_in.readUInt32();
            break;
          case TT_STAKER_ADDRESS:
            expectBytes(tag);
            staker_address = code_in.readStringRequireUtf8();
            break;
          case TT_STAKING_TIME:
            expectVarint(tag);
            staking_time = readUInt32AsLong(code_in);
            break;
          case TT_STAKING_CONFIRMATION:
            expectBytes(tag);
            staking_conf = decodeConfirmation(code_in.readBytes());
            break;
          case TT_UNBONDING:
            expectBytes(tag);
            unbonding = decodeUnbonding(code_in.readBytes());
            break;
          case TT_DELEGATION_REF:
            expectBytes(tag);
            delegation_ref = code_in.readStringRequireUtf8();
            break;
          default:
            code_in.skipField(tag);
        }
      }
    }
    catch(InvalidProtocolBufferException e)
    {
      throw e;
    }
    catch(IOException e)
    {
      throw new InvalidProtocolBufferException(e);
    }

    checkTime(staking_time, "staking time");
    if (idx < 0)
    {
      throw new InvalidProtocolBufferException("Record index out of range");
    }

    return new StoredTransaction(idx, staking_tx, staking_output_idx, staking_conf,
      (int) staking_time, staker_address, unbonding, delegation_ref);
  }

  public static BtcConfirmationInfo decodeConfirmation(ByteString data)
    throws IOException
  {
    CodedInputStream code_in = data.newCodedInput();

    ByteString block_hash = null;
    long height = 0L;

    while(true)
    {
      int tag = code_in.readTag();
      if (tag == 0) break;

      switch(WireFormat.getTagFieldNumber(tag))
      {
        case CI_BLOCK_HASH:
          expectBytes(tag);
          block_hash = code_in.readBytes();
          break;
        case CI_BLOCK_HEIGHT:
          expectVarint(tag);
          height = readUInt32AsLong(code_in);
          break;
        default:
          code_in.skipField(tag);
      }
    }

    if (block_hash == null || block_hash.size() != 32)
    {
      throw new InvalidProtocolBufferException("Confirmation block hash must be 32 bytes");
    }
    if (height > Integer.MAX_VALUE)
    {
      throw new InvalidProtocolBufferException("Confirmation height out of range: " + height);
    }

    return new BtcConfirmationInfo((int) height, Util.hashFromKey(block_hash));
  }

  public static UnbondingStoreData decodeUnbonding(ByteString data)
    throws IOException
  {
    CodedInputStream code_in = data.newCodedInput();

    ByteString unbonding_tx = null;
    long unbonding_time = 0L;
    ArrayList<CovenantSignature> sigs = new ArrayList<>();
    BtcConfirmationInfo conf = null;

    while(true)
    {
      int tag = code_in.readTag();
      if (tag == 0) break;

      switch(WireFormat.getTagFieldNumber(tag))
      {
        case UD_TX:
          expectBytes(tag);
          unbonding_tx = code_in.readBytes();
          break;
        case UD_TIME:
          expectVarint(tag);
          unbonding_time = readUInt32AsLong(code_in);
          break;
        case UD_COVENANT_SIGS:
          expectBytes(tag);
          sigs.add(decodeCovenantSig(code_in.readBytes()));
          break;
        case UD_CONFIRMATION:
          expectBytes(tag);
          conf = decodeConfirmation(code_in.readBytes());
          break;
        default:
          code_in.skipField(tag);
      }
    }

    // unbonding data always carries its transaction
    if (unbonding_tx == null || unbonding_tx.isEmpty())
    {
      throw new InvalidProtocolBufferException("Unbonding data without unbonding transaction");
    }
    checkTime(unbonding_time, "unbonding time");

    return new UnbondingStoreData(unbonding_tx, (int) unbonding_time, sigs, conf);
  }

  public static CovenantSignature decodeCovenantSig(ByteString data)
    throws IOException
  {
    CodedInputStream code_in = data.newCodedInput();

    ByteString sig = null;
    ByteString pk = null;

    while(true)
    {
      int tag = code_in.readTag();
      if (tag == 0) break;

      switch(WireFormat.getTagFieldNumber(tag))
      {
        case CS_SIG:
          expectBytes(tag);
          sig = code_in.readBytes();
          break;
        case CS_PK:
          expectBytes(tag);
          pk = code_in.readBytes();
          break;
        default:
          code_in.skipField(tag);
      }
    }

    try
    {
      return new CovenantSignature(SchnorrPubKey.parse(pk), SchnorrSignature.parse(sig));
    }
    catch(IllegalArgumentException e)
    {
      throw new InvalidProtocolBufferException("Bad covenant signature: " + e.getMessage());
    }
  }

  private static long readUInt32AsLong(CodedInputStream code_in)
    throws IOException
  {
    return code_in.readUInt32() & 0xffffffffL;
  }

  private static void checkTime(long t, String what)
    throws InvalidProtocolBufferException
  {
    if (t > StoredTransaction.MAX_LOCK_TIME)
    {
      throw new InvalidProtocolBufferException(what + " is too large. Max value is " + StoredTransaction.MAX_LOCK_TIME);
    }
  }

  private static void expectVarint(int tag)
    throws InvalidProtocolBufferException
  {
    expectWireType(tag, WireFormat.WIRETYPE_VARINT);
  }

  private static void expectBytes(int tag)
    throws InvalidProtocolBufferException
  {
    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED);
  }

  private static void expectWireType(int tag, int wire_type)
    throws InvalidProtocolBufferException
  {
    if (WireFormat.getTagWireType(tag) != wire_type)
    {
      throw new InvalidProtocolBufferException(
        "Field " + WireFormat.getTagFieldNumber(tag) + " has wire type " + WireFormat.getTagWireType(tag));
    }
  }

}
