package io.github.vevoly.petledger.api.codec;

import com.google.common.hash.Hashing;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import io.github.vevoly.petledger.api.command.MintCommand;
import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.command.TransferCommand;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;
import io.github.vevoly.petledger.api.crypto.Signer;
import io.github.vevoly.petledger.api.exception.PetNameTooLongException;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.tx.SignedCommand;

import java.nio.charset.StandardCharsets;

/**
 * <h3>命令编码器 (Command Codec)</h3>
 *
 * <p>
 * 负责把命令编码为规范的二进制载荷（签名与哈希的输入），并在编码边界上强制名称长度上限 N。
 * 名称按 UTF-8 字节计长。
 * </p>
 *
 * <h3>载荷格式 (Payload Layout):</h3>
 * <pre>
 * version:u8 | txId:str | signer:str | type:u8 | fields...
 *   MINT     -> name:str | species:u8 | petId:u32
 *   TRANSFER -> receiver:str
 *   FEED / SLEEP -> (none)
 *
 * str = length:u32 | UTF-8 bytes
 * </pre>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Command Codec.</b><br>
 * Encodes commands into the canonical binary payload (input of signing and hashing)
 * and enforces the name bound N at the encoding boundary. Names are measured in UTF-8 bytes.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class CommandCodec {

    private static final byte PAYLOAD_VERSION = 1;

    private final int maxNameLength;

    public CommandCodec() {
        this(PetLedgerConstant.DEFAULT_MAX_NAME_LENGTH);
    }

    /**
     * @param maxNameLength 名称最大字节数 (Maximum name length in bytes), 构造后不可变 / fixed after construction
     */
    public CommandCodec(int maxNameLength) {
        if (maxNameLength <= 0) {
            throw new IllegalArgumentException("Max name length must be greater than 0");
        }
        this.maxNameLength = maxNameLength;
    }

    public int getMaxNameLength() {
        return maxNameLength;
    }

    /**
     * 校验名称长度 (Check the name bound).
     *
     * @throws PetNameTooLongException 超出上限 / the bound is exceeded
     */
    public void checkName(String name) throws PetNameTooLongException {
        int length = name.getBytes(StandardCharsets.UTF_8).length;
        if (length > maxNameLength) {
            throw new PetNameTooLongException(length, maxNameLength);
        }
    }

    /**
     * 校验命令是否满足编码约束 (Check all encoding constraints of a command).
     */
    public void check(PetCommand command) throws PetNameTooLongException {
        if (command instanceof MintCommand) {
            checkName(((MintCommand) command).getName());
        }
    }

    /**
     * 编码签名载荷 (Encode the payload to be signed).
     */
    public byte[] encodePayload(AccountId signer, String txId, PetCommand command) throws PetNameTooLongException {
        check(command);
        ByteArrayDataOutput out = ByteStreams.newDataOutput();
        out.writeByte(PAYLOAD_VERSION);
        writeString(out, txId);
        writeString(out, signer.getAddress());
        out.writeByte(command.getType().getCode());
        switch (command.getType()) {
            case MINT:
                MintCommand mint = (MintCommand) command;
                writeString(out, mint.getName());
                out.writeByte(mint.getSpecies().getCode());
                out.writeInt((int) mint.getPetId()); // u32, 按位写入 / written bit-for-bit
                break;
            case TRANSFER:
                writeString(out, ((TransferCommand) command).getReceiver().getAddress());
                break;
            case FEED:
            case SLEEP:
                break;
            default:
                throw new IllegalStateException("Unhandled command type: " + command.getType());
        }
        return out.toByteArray();
    }

    // 长度前缀 + UTF-8，没有 writeUTF 的 64KB 上限 / length-prefixed UTF-8, no 64KB cap as with writeUTF
    private static void writeString(ByteArrayDataOutput out, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    /**
     * 载荷哈希 (Payload hash), SHA-256 小写十六进制 / lower-case hex SHA-256.
     */
    public static String hash(byte[] payload) {
        return Hashing.sha256().hashBytes(payload).toString();
    }

    /**
     * 打包并签名 (Encode, sign and wrap into an envelope).
     */
    public SignedCommand seal(Signer signer, String txId, PetCommand command) throws PetNameTooLongException {
        byte[] payload = encodePayload(signer.getAccount(), txId, command);
        return new SignedCommand(signer.getAccount(), txId, command, payload, signer.sign(payload), hash(payload));
    }
}
