package io.batchreview.model;

/**
 * Position of a change inside its relation chain. Position 1 is the base (earliest unmerged
 * ancestor); positions grow toward the tip. Merged members are not counted.
 */
public record ChainInfo(
        boolean inChain,
        int position,
        int chainLength,
        String chainBaseId,
        int chainBaseNumber
) {
    private static final ChainInfo STANDALONE = new ChainInfo(false, 0, 0, null, 0);

    public static ChainInfo standalone() {
        return STANDALONE;
    }

    public static ChainInfo of(int position, int chainLength, String chainBaseId, int chainBaseNumber) {
        return new ChainInfo(true, position, chainLength, chainBaseId, chainBaseNumber);
    }
}
