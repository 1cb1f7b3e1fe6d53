package io.github.vevoly.petledger.api.exception;

/**
 * <h3>宠物名称超长异常</h3>
 *
 * <p>由编码层在命令离开客户端之前抛出，调度器不再校验名称长度。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Pet name too long.</b><br>
 * Raised by the codec before the command leaves the client; the dispatcher never checks the bound again.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class PetNameTooLongException extends PetLedgerException {

    private final int length;
    private final int maxLength;

    public PetNameTooLongException(int length, int maxLength) {
        super(PetLedgerErrorCode.PET_NAME_TOO_LONG,
                String.format("Pet name is %d bytes, the limit is %d", length, maxLength));
        this.length = length;
        this.maxLength = maxLength;
    }

    public int getLength() {
        return length;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
