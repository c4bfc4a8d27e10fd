package com.liquidswap.wallet.lwk;

/**
 * The local store is at a height newer than the update being applied.
 */
public class UpdateHeightTooOldException extends DescriptorWalletException {

    private final int updateHeight;
    private final int storeHeight;

    public UpdateHeightTooOldException(int updateHeight, int storeHeight) {
        super("Update height " + updateHeight + " is older than store height " + storeHeight);
        this.updateHeight = updateHeight;
        this.storeHeight = storeHeight;
    }

    public int getUpdateHeight() {
        return updateHeight;
    }

    public int getStoreHeight() {
        return storeHeight;
    }
}
