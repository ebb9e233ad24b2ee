package ai.texdocx.converter.writer;

public interface TableHandle {

    ParagraphHandle cell(int row, int column);

    /**
     * Merges the cells {@code firstColumn..lastColumn} (inclusive) of {@code row} into one.
     */
    void mergeAcross(int row, int firstColumn, int lastColumn);
}
