package com.deckinverter.util;

import com.deckinverter.DeckFixtures;
import com.deckinverter.model.InversionConfig;
import com.deckinverter.model.RgbColor;
import org.apache.poi.sl.usermodel.PictureData.PictureType;
import org.apache.poi.sl.usermodel.ShapeType;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFAutoShape;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.drawingml.x2006.main.CTShapeProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.STSchemeColorVal;
import org.openxmlformats.schemas.presentationml.x2006.main.CTBackgroundProperties;
import org.openxmlformats.schemas.presentationml.x2006.main.CTShape;

import java.awt.Color;
import java.awt.Rectangle;
import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ShapeColorRewriterTest {

    private static final RgbColor CREAM = new RgbColor(0xF5, 0xEE, 0xDC);
    private static final RgbColor NAVY = new RgbColor(0x10, 0x18, 0x40);

    private XMLSlideShow deck;
    private XSLFSlide slide;
    private Diagnostics diagnostics;

    @BeforeEach
    void setUp() {
        deck = new XMLSlideShow();
        slide = deck.createSlide();
        diagnostics = new Diagnostics();
    }

    @AfterEach
    void tearDown() throws IOException {
        deck.close();
    }

    private ShapeColorRewriter rewriter(RgbColor foreground, RgbColor background) {
        return new ShapeColorRewriter(InversionConfig.builder()
                .foregroundColor(foreground)
                .backgroundColor(background)
                .recolorBackground(false)
                .build(), diagnostics);
    }

    private static XSLFTextRun firstRun(XSLFAutoShape shape) {
        return shape.getTextParagraphs().get(0).getTextRuns().get(0);
    }

    @Test
    void whiteFillAndBlackTextKeepTheirPolarityOnAWhiteOnBlackScheme() {
        XSLFAutoShape box = DeckFixtures.addTextBox(slide, "scenario", Color.WHITE, Color.BLACK);

        List<String> warnings = rewriter(RgbColor.WHITE, RgbColor.BLACK).recolorSlide(slide);

        assertThat(warnings).isEmpty();
        assertThat(RgbColor.of(box.getFillColor())).isEqualTo(RgbColor.WHITE);
        assertThat(RgbColor.of(DeckFixtures.runColor(firstRun(box)))).isEqualTo(RgbColor.BLACK);
    }

    @Test
    void swappingTheConfiguredColorsSwapsTheLiteralColors() {
        XSLFAutoShape box = DeckFixtures.addTextBox(slide, "swapped", Color.WHITE, Color.BLACK);

        List<String> warnings = rewriter(RgbColor.BLACK, RgbColor.WHITE).recolorSlide(slide);

        assertThat(warnings).isEmpty();
        assertThat(RgbColor.of(box.getFillColor())).isEqualTo(RgbColor.BLACK);
        assertThat(RgbColor.of(DeckFixtures.runColor(firstRun(box)))).isEqualTo(RgbColor.WHITE);
    }

    @Test
    void explicitColorsMoveOntoTheScheme() {
        XSLFAutoShape box = DeckFixtures.addTextBox(slide, "scheme",
                new Color(230, 230, 230), new Color(20, 20, 90));
        box.setLineColor(new Color(40, 40, 40));

        rewriter(CREAM, NAVY).recolorSlide(slide);

        assertThat(RgbColor.of(box.getFillColor())).isEqualTo(CREAM);
        assertThat(RgbColor.of(box.getLineColor())).isEqualTo(NAVY);
        assertThat(RgbColor.of(DeckFixtures.runColor(firstRun(box)))).isEqualTo(NAVY);
    }

    @Test
    void gradientFillIsLeftAloneWithAWarning() {
        XSLFAutoShape box = DeckFixtures.addTextBox(slide, "gradient", Color.WHITE, Color.BLACK);
        CTShapeProperties spPr = ((CTShape) box.getXmlObject()).getSpPr();
        spPr.unsetSolidFill();
        spPr.addNewGradFill();

        List<String> warnings = rewriter(CREAM, NAVY).recolorSlide(slide);

        assertThat(warnings).containsExactly("Shape '" + box.getShapeName() + "': gradient fill left unchanged");
        assertThat(spPr.isSetGradFill()).isTrue();
        assertThat(RgbColor.of(DeckFixtures.runColor(firstRun(box)))).isEqualTo(NAVY);
    }

    @Test
    void themeColoredFillIsLeftAloneWithAWarning() {
        XSLFAutoShape box = DeckFixtures.addTextBox(slide, "theme", Color.WHITE, Color.BLACK);
        CTShapeProperties spPr = ((CTShape) box.getXmlObject()).getSpPr();
        spPr.getSolidFill().unsetSrgbClr();
        spPr.getSolidFill().addNewSchemeClr().setVal(STSchemeColorVal.ACCENT_1);

        List<String> warnings = rewriter(CREAM, NAVY).recolorSlide(slide);

        assertThat(warnings).containsExactly("Shape '" + box.getShapeName() + "': theme-colored fill left unchanged");
        assertThat(spPr.getSolidFill().isSetSchemeClr()).isTrue();
    }

    @Test
    void shapesWithoutExplicitColorsAreUntouched() {
        XSLFAutoShape box = slide.createAutoShape();
        box.setShapeType(ShapeType.ELLIPSE);
        box.setAnchor(new Rectangle(10, 10, 50, 50));
        box.addNewTextParagraph().addNewTextRun().setText("inherits");

        List<String> warnings = rewriter(CREAM, NAVY).recolorSlide(slide);

        assertThat(warnings).isEmpty();
        CTShapeProperties spPr = ((CTShape) box.getXmlObject()).getSpPr();
        assertThat(spPr.isSetSolidFill()).isFalse();
        assertThat(firstRun(box).getXmlObject().toString()).doesNotContain("solidFill");
    }

    @Test
    void nestedGroupsAreRecoloredAtAnyDepth() {
        XSLFGroupShape outer = slide.createGroup();
        XSLFGroupShape inner = outer.createGroup();
        XSLFAutoShape deep = inner.createAutoShape();
        deep.setAnchor(new Rectangle(0, 0, 10, 10));
        deep.setFillColor(Color.BLACK);
        XSLFAutoShape shallow = outer.createAutoShape();
        shallow.setAnchor(new Rectangle(20, 0, 10, 10));
        shallow.setFillColor(Color.WHITE);

        rewriter(CREAM, NAVY).recolorSlide(slide);

        assertThat(RgbColor.of(deep.getFillColor())).isEqualTo(NAVY);
        assertThat(RgbColor.of(shallow.getFillColor())).isEqualTo(CREAM);
    }

    @Test
    void tableCellsGetFillAndTextRecolored() {
        XSLFTable table = slide.createTable();
        XSLFTableCell cell = table.addRow().addCell();
        cell.setFillColor(Color.WHITE);
        XSLFTextRun run = cell.addNewTextParagraph().addNewTextRun();
        run.setText("cell");
        run.setFontColor(Color.BLACK);

        rewriter(CREAM, NAVY).recolorSlide(slide);

        assertThat(RgbColor.of(cell.getFillColor())).isEqualTo(CREAM);
        assertThat(RgbColor.of(DeckFixtures.runColor(run))).isEqualTo(NAVY);
    }

    @Test
    void repaintedBackgroundUsesTheBackgroundColor() {
        InversionConfig config = InversionConfig.builder()
                .foregroundColor(CREAM)
                .backgroundColor(NAVY)
                .build();

        new ShapeColorRewriter(config, diagnostics).recolorSlide(slide);

        byte[] rgb = slide.getXmlObject().getCSld().getBg().getBgPr().getSolidFill().getSrgbClr().getVal();
        assertThat(rgb).containsExactly((byte) NAVY.getRed(), (byte) NAVY.getGreen(), (byte) NAVY.getBlue());
    }

    @Test
    void explicitSolidBackgroundFollowsPolarityWhenNotRepainted() {
        slide.getXmlObject().getCSld().addNewBg();
        slide.getBackground().setFillColor(Color.WHITE);

        rewriter(CREAM, NAVY).recolorSlide(slide);

        byte[] rgb = slide.getXmlObject().getCSld().getBg().getBgPr().getSolidFill().getSrgbClr().getVal();
        assertThat(rgb).containsExactly((byte) CREAM.getRed(), (byte) CREAM.getGreen(), (byte) CREAM.getBlue());
    }

    @Test
    void gradientBackgroundWarnsWhenNotRepainted() {
        CTBackgroundProperties bgPr = slide.getXmlObject().getCSld().addNewBg().addNewBgPr();
        bgPr.addNewGradFill();
        bgPr.addNewEffectLst();

        List<String> warnings = rewriter(CREAM, NAVY).recolorSlide(slide);

        assertThat(warnings).containsExactly("Background: gradient left unchanged");
    }

    @Test
    void picturesAreReplacedAndRelinked() {
        byte[] png = DeckFixtures.png(DeckFixtures.solidImage(6, 6, Color.WHITE, false));
        XSLFPictureShape picture = DeckFixtures.addPicture(deck, slide, png);
        String originalPart = picture.getPictureData().getPackagePart().getPartName().getName();

        List<String> warnings = rewriter(CREAM, NAVY).recolorSlide(slide);

        assertThat(warnings).isEmpty();
        assertThat(picture.getPictureData().getType()).isEqualTo(PictureType.JPEG);
        assertThat(picture.getPictureData().getPackagePart().getPartName().getName()).isNotEqualTo(originalPart);
    }

    @Test
    void pictureSharedBetweenSlidesIsTransformedOnce() {
        byte[] png = DeckFixtures.png(DeckFixtures.solidImage(6, 6, Color.BLACK, false));
        XSLFPictureShape first = DeckFixtures.addPicture(deck, slide, png);
        XSLFSlide second = deck.createSlide();
        XSLFPictureShape again = DeckFixtures.addPicture(deck, second, png);
        int partsBefore = deck.getPictureData().size();

        ShapeColorRewriter rewriter = rewriter(CREAM, NAVY);
        rewriter.recolorSlide(slide);
        rewriter.recolorSlide(second);

        assertThat(deck.getPictureData()).hasSize(partsBefore + 1);
        assertThat(again.getPictureData().getPackagePart().getPartName())
                .isEqualTo(first.getPictureData().getPackagePart().getPartName());
    }

    @Test
    void picturesStayWhenImageInversionIsOff() {
        byte[] png = DeckFixtures.png(DeckFixtures.solidImage(6, 6, Color.WHITE, false));
        XSLFPictureShape picture = DeckFixtures.addPicture(deck, slide, png);
        InversionConfig config = InversionConfig.builder()
                .foregroundColor(CREAM)
                .backgroundColor(NAVY)
                .invertImages(false)
                .build();

        new ShapeColorRewriter(config, diagnostics).recolorSlide(slide);

        assertThat(picture.getPictureData().getType()).isEqualTo(PictureType.PNG);
        assertThat(picture.getPictureData().getData()).isEqualTo(png);
    }

    @Test
    void undecodablePictureWarnsAndStays() throws IOException {
        byte[] png = DeckFixtures.png(DeckFixtures.solidImage(6, 6, Color.WHITE, false));
        XSLFPictureShape picture = DeckFixtures.addPicture(deck, slide, png);
        picture.getPictureData().setData("broken".getBytes());

        List<String> warnings = rewriter(CREAM, NAVY).recolorSlide(slide);

        assertThat(warnings).singleElement().asString()
                .startsWith("Shape '" + picture.getShapeName() + "': Image could not be decoded");
        assertThat(picture.getPictureData().getType()).isEqualTo(PictureType.PNG);
    }
}
