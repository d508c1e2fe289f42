package org.example.stackanalysis.variant;

/**
 * Line patterns recognised in the analysis tool's standard output.
 * <p>
 * A result is a block: one opening line followed by data rows. Either the opening
 * line or each row names the image, depending on how the plugin prints its table.
 */
public interface CaptureGrammar {

    /**
     * @return the opening this line represents, or null if it does not open a block
     */
    BlockOpening matchOpening(String line);

    /**
     * @return the data row this line represents, or null if it ends the current block
     */
    BlockRow matchRow(String line);

    /**
     * Line that starts a result block.
     */
    final class BlockOpening {
        private final Long imageId;
        private final String seed;

        /**
         * @param imageId image the block belongs to, or null when each row names its image
         * @param seed    first line of the stored block (column names or the stage label)
         */
        public BlockOpening(Long imageId, String seed) {
            this.imageId = imageId;
            this.seed = seed;
        }

        public Long getImageId() {
            return imageId;
        }

        public String getSeed() {
            return seed;
        }
    }

    /**
     * Data line inside a result block.
     */
    final class BlockRow {
        private final Long imageId;
        private final String text;

        /**
         * @param imageId image named by the row, or null to use the opening's image
         * @param text    text stored for the row
         */
        public BlockRow(Long imageId, String text) {
            this.imageId = imageId;
            this.text = text;
        }

        public Long getImageId() {
            return imageId;
        }

        public String getText() {
            return text;
        }
    }
}
