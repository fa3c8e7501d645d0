package com.deckinverter.util;

import com.deckinverter.model.InversionConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLDocumentPart.RelationPart;
import org.apache.poi.sl.draw.DrawPaint;
import org.apache.poi.sl.usermodel.PaintStyle;
import org.apache.poi.sl.usermodel.PictureData.PictureType;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFBackground;
import org.apache.poi.xslf.usermodel.XSLFGraphicFrame;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFRelation;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSimpleShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.drawingml.x2006.main.CTLineProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTRegularTextRun;
import org.openxmlformats.schemas.drawingml.x2006.main.CTShapeProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTSolidColorFillProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTableCell;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTableCellProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextCharacterProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextField;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextLineBreak;
import org.openxmlformats.schemas.presentationml.x2006.main.CTBackground;
import org.openxmlformats.schemas.presentationml.x2006.main.CTBackgroundProperties;
import org.openxmlformats.schemas.presentationml.x2006.main.CTCommonSlideData;
import org.openxmlformats.schemas.presentationml.x2006.main.CTConnector;
import org.openxmlformats.schemas.presentationml.x2006.main.CTPicture;
import org.openxmlformats.schemas.presentationml.x2006.main.CTShape;

import java.awt.Color;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites the explicit colors of a deck's slides onto the configured scheme.
 * <p>
 * Only flat colors written on the shape itself are touched: solid fills,
 * solid outlines and solid run colors. Gradient, pattern and picture fills
 * and theme color references stay as they are and are reported; attributes
 * that inherit from the layout or theme are left alone silently. Pictures are
 * handed to {@link ImageColorTransformer}.
 * <p>
 * One instance serves one document, since picture parts shared between
 * slides are transformed once and cached.
 */
@Slf4j
public class ShapeColorRewriter {

    private static final Set<PictureType> VECTOR_PICTURES = EnumSet.of(
            PictureType.EMF, PictureType.WMF, PictureType.PICT, PictureType.SVG, PictureType.EPS);

    private enum ColorKind { NONE, SOLID, THEME, GRADIENT, PATTERN, PICTURE }

    private final InversionConfig config;
    private final ColorPolarity polarity;
    private final ColorPolarity imagePolarity;
    private final Diagnostics diagnostics;

    /** Picture part name -> replacement part, or null when the transform did not produce one. */
    private final Map<String, XSLFPictureData> replacedPictures = new HashMap<>();
    private final Map<String, ImageTransformResult> pictureResults = new HashMap<>();

    public ShapeColorRewriter(InversionConfig config, Diagnostics diagnostics) {
        this.config = config;
        this.polarity = ColorPolarity.forShapes(config);
        this.imagePolarity = ColorPolarity.forImages(config);
        this.diagnostics = diagnostics;
    }

    /**
     * Recolor one slide in place.
     *
     * @return the warnings added while processing this slide
     */
    public List<String> recolorSlide(XSLFSlide slide) {
        int mark = diagnostics.size();

        try {
            recolorBackground(slide);
        } catch (Exception e) {
            log.debug("Background recolor failed", e);
            diagnostics.warn("Background: %s", describe(e));
        }

        recolorShapes(slide.getShapes());
        return diagnostics.since(mark);
    }

    // ---------------------------------------------------------------- traversal

    private void recolorShapes(List<XSLFShape> shapes) {
        for (XSLFShape shape : shapes) {
            try {
                recolorShape(shape);
            } catch (Exception e) {
                log.debug("Shape '{}' failed", shape.getShapeName(), e);
                diagnostics.warn("Shape '%s': %s", shape.getShapeName(), describe(e));
            }
        }
    }

    private void recolorShape(XSLFShape shape) {
        if (shape instanceof XSLFGroupShape group) {
            // children first; a group has no paint of its own in the XSLF model
            recolorShapes(group.getShapes());
        } else if (shape instanceof XSLFPictureShape picture) {
            recolorLine(picture);
            recolorPicture(picture);
        } else if (shape instanceof XSLFTable table) {
            recolorTable(table);
        } else if (shape instanceof XSLFSimpleShape simple) {
            recolorFill(simple);
            recolorLine(simple);
            if (simple instanceof XSLFTextShape text) {
                recolorText(text);
            }
        } else if (shape instanceof XSLFGraphicFrame frame) {
            log.debug("Skipping graphic frame '{}' (charts and embedded objects keep their colors)",
                    frame.getShapeName());
        }
    }

    // ---------------------------------------------------------------- background

    private void recolorBackground(XSLFSlide slide) {
        CTCommonSlideData cSld = slide.getXmlObject().getCSld();

        if (config.isRecolorBackground()) {
            // create a slide-level background so layouts and masters stay untouched
            if (!cSld.isSetBg()) {
                cSld.addNewBg();
            }
            slide.getBackground().setFillColor(config.getBackgroundColor().toAwtColor());
            return;
        }

        if (!cSld.isSetBg()) {
            return;
        }
        CTBackground bg = cSld.getBg();
        if (!bg.isSetBgPr()) {
            // bgRef points into the theme's background fill list
            return;
        }
        CTBackgroundProperties bgPr = bg.getBgPr();
        ColorKind kind = bgPr.isSetSolidFill() ? solidKind(bgPr.getSolidFill())
                : bgPr.isSetGradFill() ? ColorKind.GRADIENT
                : bgPr.isSetPattFill() ? ColorKind.PATTERN
                : bgPr.isSetBlipFill() ? ColorKind.PICTURE
                : ColorKind.NONE;

        if (kind == ColorKind.SOLID) {
            XSLFBackground background = slide.getBackground();
            Color current = background.getFillColor();
            if (current != null) {
                background.setFillColor(polarity.map(current));
            }
        } else if (kind != ColorKind.NONE) {
            diagnostics.warn("Background: %s left unchanged", describeKind(kind));
        }
    }

    // ---------------------------------------------------------------- fill & line

    private void recolorFill(XSLFSimpleShape shape) {
        CTShapeProperties spPr = shapeProperties(shape);
        if (spPr == null) {
            return;
        }
        ColorKind kind = spPr.isSetSolidFill() ? solidKind(spPr.getSolidFill())
                : spPr.isSetGradFill() ? ColorKind.GRADIENT
                : spPr.isSetPattFill() ? ColorKind.PATTERN
                : spPr.isSetBlipFill() ? ColorKind.PICTURE
                : ColorKind.NONE;

        if (kind == ColorKind.SOLID) {
            Color current = shape.getFillColor();
            if (current != null) {
                shape.setFillColor(polarity.map(current));
            }
        } else if (kind != ColorKind.NONE) {
            warnUnchanged(shape.getShapeName(), "fill", kind);
        }
    }

    private void recolorLine(XSLFSimpleShape shape) {
        CTShapeProperties spPr = shapeProperties(shape);
        if (spPr == null || !spPr.isSetLn()) {
            return;
        }
        CTLineProperties ln = spPr.getLn();
        ColorKind kind = ln.isSetSolidFill() ? solidKind(ln.getSolidFill())
                : ln.isSetGradFill() ? ColorKind.GRADIENT
                : ln.isSetPattFill() ? ColorKind.PATTERN
                : ColorKind.NONE;

        if (kind == ColorKind.SOLID) {
            Color current = shape.getLineColor();
            if (current != null) {
                shape.setLineColor(polarity.map(current));
            }
        } else if (kind != ColorKind.NONE) {
            warnUnchanged(shape.getShapeName(), "line", kind);
        }
    }

    // ---------------------------------------------------------------- text

    private void recolorText(XSLFTextShape shape) {
        for (XSLFTextParagraph paragraph : shape.getTextParagraphs()) {
            for (XSLFTextRun run : paragraph.getTextRuns()) {
                recolorRun(shape.getShapeName(), run);
            }
        }
    }

    private void recolorRun(String shapeName, XSLFTextRun run) {
        CTTextCharacterProperties rPr = runProperties(run.getXmlObject());
        if (rPr == null) {
            return;
        }
        ColorKind kind = rPr.isSetSolidFill() ? solidKind(rPr.getSolidFill())
                : rPr.isSetGradFill() ? ColorKind.GRADIENT
                : rPr.isSetPattFill() ? ColorKind.PATTERN
                : ColorKind.NONE;

        if (kind == ColorKind.SOLID) {
            PaintStyle paint = run.getFontColor();
            if (paint instanceof PaintStyle.SolidPaint solid) {
                Color current = DrawPaint.applyColorTransform(solid.getSolidColor());
                run.setFontColor(polarity.map(current));
            }
        } else if (kind != ColorKind.NONE) {
            warnUnchanged(shapeName, "text color", kind);
        }
    }

    private static CTTextCharacterProperties runProperties(XmlObject xml) {
        if (xml instanceof CTRegularTextRun r) {
            return r.isSetRPr() ? r.getRPr() : null;
        } else if (xml instanceof CTTextField f) {
            return f.isSetRPr() ? f.getRPr() : null;
        } else if (xml instanceof CTTextLineBreak br) {
            return br.isSetRPr() ? br.getRPr() : null;
        }
        return null;
    }

    // ---------------------------------------------------------------- tables

    private void recolorTable(XSLFTable table) {
        for (XSLFTableRow row : table.getRows()) {
            for (XSLFTableCell cell : row.getCells()) {
                recolorCellFill(table.getShapeName(), cell);
                recolorText(cell);
            }
        }
    }

    private void recolorCellFill(String tableName, XSLFTableCell cell) {
        CTTableCell ctCell = (CTTableCell) cell.getXmlObject();
        if (!ctCell.isSetTcPr()) {
            return;
        }
        CTTableCellProperties tcPr = ctCell.getTcPr();
        ColorKind kind = tcPr.isSetSolidFill() ? solidKind(tcPr.getSolidFill())
                : tcPr.isSetGradFill() ? ColorKind.GRADIENT
                : tcPr.isSetPattFill() ? ColorKind.PATTERN
                : tcPr.isSetBlipFill() ? ColorKind.PICTURE
                : ColorKind.NONE;

        if (kind == ColorKind.SOLID) {
            Color current = cell.getFillColor();
            if (current != null) {
                cell.setFillColor(polarity.map(current));
            }
        } else if (kind != ColorKind.NONE) {
            warnUnchanged(tableName, "cell fill", kind);
        }
    }

    // ---------------------------------------------------------------- pictures

    private void recolorPicture(XSLFPictureShape picture) {
        if (!config.isInvertImages()) {
            return;
        }
        XSLFPictureData data = picture.getPictureData();
        if (data == null) {
            diagnostics.warn("Shape '%s': linked picture left unchanged", picture.getShapeName());
            return;
        }
        if (VECTOR_PICTURES.contains(data.getType())) {
            log.debug("Skipping vector picture '{}' ({})", picture.getShapeName(), data.getType());
            return;
        }

        String partName = data.getPackagePart().getPartName().getName();
        ImageTransformResult result = pictureResults.get(partName);
        if (result == null) {
            result = ImageColorTransformer.transform(
                    data.getData(), imagePolarity, config.getImageQuality(), config.isInvertImages());
            pictureResults.put(partName, result);
            if (result.isTransformed()) {
                XMLSlideShow slideShow = picture.getSheet().getSlideShow();
                replacedPictures.put(partName,
                        slideShow.addPicture(result.getData(), result.getFormat().getPictureType()));
            }
        }

        switch (result.getStatus()) {
            case TRANSFORMED -> relink(picture, replacedPictures.get(partName));
            case FAILED -> diagnostics.warn("Shape '%s': %s", picture.getShapeName(), result.getWarning());
            case UNCHANGED -> { }
        }
    }

    private void relink(XSLFPictureShape picture, XSLFPictureData replacement) {
        RelationPart relation = picture.getSheet().addRelation(null, XSLFRelation.IMAGES, replacement);
        CTPicture ct = (CTPicture) picture.getXmlObject();
        ct.getBlipFill().getBlip().setEmbed(relation.getRelationship().getId());
    }

    // ---------------------------------------------------------------- helpers

    private static CTShapeProperties shapeProperties(XSLFShape shape) {
        XmlObject xml = shape.getXmlObject();
        if (xml instanceof CTShape sp) {
            return sp.getSpPr();
        } else if (xml instanceof CTConnector cxn) {
            return cxn.getSpPr();
        } else if (xml instanceof CTPicture pic) {
            return pic.getSpPr();
        }
        return null;
    }

    private static ColorKind solidKind(CTSolidColorFillProperties fill) {
        if (fill.isSetSchemeClr()) {
            return ColorKind.THEME;
        }
        if (fill.isSetSrgbClr() || fill.isSetSysClr() || fill.isSetPrstClr()
                || fill.isSetScrgbClr() || fill.isSetHslClr()) {
            return ColorKind.SOLID;
        }
        return ColorKind.NONE;
    }

    private void warnUnchanged(String shapeName, String attribute, ColorKind kind) {
        diagnostics.warn("Shape '%s': %s %s left unchanged", shapeName, describeKind(kind), attribute);
    }

    private static String describeKind(ColorKind kind) {
        return switch (kind) {
            case THEME -> "theme-colored";
            case GRADIENT -> "gradient";
            case PATTERN -> "pattern";
            case PICTURE -> "picture";
            default -> "unsupported";
        };
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
