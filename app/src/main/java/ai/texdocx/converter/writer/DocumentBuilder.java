package ai.texdocx.converter.writer;

import ai.texdocx.converter.document.ListKind;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Output backend consuming blocks in reading order.
 */
public interface DocumentBuilder extends Closeable {

    ParagraphHandle addHeading(int level);

    ParagraphHandle addParagraph();

    /**
     * @param startsNewList when true numbering restarts for this item
     */
    ParagraphHandle addListItem(ListKind kind, int level, boolean startsNewList);

    TableHandle addTable(int rows, int columns);

    void save(Path target) throws IOException;
}
