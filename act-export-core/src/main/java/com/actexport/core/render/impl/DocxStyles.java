package com.actexport.core.render.impl;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTHpsMeasure;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPrGeneral;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

import java.math.BigInteger;

/**
 * Paragraph styles of generated documents. A blank {@link XWPFDocument} has no style
 * definitions, so the title and heading styles are added before anything is written.
 */
final class DocxStyles {

    static final String TITLE = "Title";
    private static final String HEADING_PREFIX = "Heading";

    private static final int TITLE_SIZE_PT = 16;
    private static final int[] HEADING_SIZES_PT = {16, 14, 13, 12, 12, 11, 11, 11, 11};

    private DocxStyles() {
    }

    /**
     * Returns the style id of a heading level.
     *
     * @param level heading level, 1..9
     * @return style id such as {@code Heading2}
     */
    static String heading(int level) {
        return HEADING_PREFIX + level;
    }

    /**
     * Adds the title style and the heading styles 1..maxLevel where missing.
     *
     * @param document target document
     * @param maxLevel deepest heading level used
     */
    static void ensure(XWPFDocument document, int maxLevel) {
        XWPFStyles styles = document.createStyles();
        if (!styles.styleExist(TITLE)) {
            styles.addStyle(paragraphStyle(TITLE, "Title", null, TITLE_SIZE_PT));
        }
        for (int level = 1; level <= maxLevel; level++) {
            String id = heading(level);
            if (!styles.styleExist(id)) {
                styles.addStyle(paragraphStyle(id, "heading " + level,
                    BigInteger.valueOf(level - 1L), HEADING_SIZES_PT[level - 1]));
            }
        }
    }

    private static XWPFStyle paragraphStyle(String styleId, String name, BigInteger outlineLevel, int sizePt) {
        CTStyle ctStyle = CTStyle.Factory.newInstance();
        ctStyle.setStyleId(styleId);
        ctStyle.setType(STStyleType.PARAGRAPH);
        ctStyle.addNewName().setVal(name);
        ctStyle.addNewBasedOn().setVal("Normal");
        ctStyle.addNewNext().setVal("Normal");

        if (outlineLevel != null) {
            CTPPrGeneral ppr = ctStyle.addNewPPr();
            ppr.addNewOutlineLvl().setVal(outlineLevel);
        }

        CTRPr rpr = ctStyle.addNewRPr();
        rpr.addNewB();
        BigInteger halfPoints = BigInteger.valueOf(sizePt * 2L);
        CTHpsMeasure sz = rpr.addNewSz();
        sz.setVal(halfPoints);
        CTHpsMeasure szCs = rpr.addNewSzCs();
        szCs.setVal(halfPoints);

        ctStyle.addNewQFormat();
        return new XWPFStyle(ctStyle);
    }
}
