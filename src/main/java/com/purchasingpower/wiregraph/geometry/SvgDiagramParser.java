package com.purchasingpower.wiregraph.geometry;

import com.purchasingpower.wiregraph.config.DiagramConventions;
import com.purchasingpower.wiregraph.core.DiagramGeometry;
import com.purchasingpower.wiregraph.core.Point;
import com.purchasingpower.wiregraph.core.Polyline;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.exception.DiagramParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the geometry of a circuit diagram exported as SVG.
 *
 * <p>Labels come from {@code <text>} elements positioned by a {@code matrix(...)}
 * transform. Wires come from {@code <polyline>} elements and from {@code <path>}
 * elements whose style class marks them as routing wires or ground arrows. Splice dots
 * are short unclassed paths made of curves.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SvgDiagramParser {

    private static final Pattern MATRIX_POSITION = Pattern.compile("matrix\\([^)]+\\s+(-?[\\d.]+)\\s+(-?[\\d.]+)\\)");

    private final DiagramConventions conventions;
    private final ConnectorLabelMerger labelMerger;
    private final SpliceDotMapper spliceDotMapper;

    public DiagramGeometry parse(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toString());
        } catch (IOException e) {
            throw new DiagramParseException("Cannot read diagram: " + e.getMessage(), file.toString(), e);
        }
    }

    public DiagramGeometry parse(String svg, String sourceName) {
        return parse(new ByteArrayInputStream(svg.getBytes(StandardCharsets.UTF_8)), sourceName);
    }

    public DiagramGeometry parse(InputStream in, String sourceName) {
        Document document = readDocument(in, sourceName);

        List<Token> labels = readLabels(document);
        List<Point> dots = new ArrayList<>();
        List<Polyline> routingPaths = new ArrayList<>();
        List<Polyline> groundArrows = new ArrayList<>();
        int skipped = 0;

        NodeList paths = document.getElementsByTagNameNS("*", "path");
        for (int i = 0; i < paths.getLength(); i++) {
            Element path = (Element) paths.item(i);
            String styleClass = path.getAttribute("class").trim();
            String data = path.getAttribute("d").trim();
            if (data.isEmpty()) {
                continue;
            }

            if (styleClass.isEmpty()) {
                spliceDot(data).ifPresent(dots::add);
            } else if (conventions.getGroundArrowClasses().contains(styleClass)) {
                Optional<Polyline> arrow = PathDataParser.parsePath(data);
                if (arrow.isPresent()) {
                    groundArrows.add(arrow.get());
                } else {
                    skipped++;
                }
            } else if (conventions.getRoutingWireClasses().contains(styleClass)
                || (conventions.getStaircaseRoutingClasses().contains(styleClass) && hasVerticalRun(data))) {
                Optional<Polyline> route = PathDataParser.parsePath(data);
                if (route.isPresent()) {
                    routingPaths.add(route.get());
                } else {
                    skipped++;
                }
            }
        }

        List<Polyline> polylines = readPolylines(document);

        List<Token> tokens = spliceDotMapper.apply(labelMerger.merge(labels), dots);
        if (skipped > 0) {
            log.warn("Skipped {} unparseable paths in {}", skipped, sourceName);
        }
        log.info("Parsed {}: {} labels, {} splice dots, {} polylines, {} routing paths, {} ground arrows",
            sourceName, tokens.size(), dots.size(), polylines.size(), routingPaths.size(), groundArrows.size());

        return DiagramGeometry.builder()
            .tokens(tokens)
            .polylines(polylines)
            .routingPaths(routingPaths)
            .groundArrows(groundArrows)
            .build();
    }

    private Document readDocument(InputStream in, String sourceName) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(in);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new DiagramParseException("Malformed diagram: " + e.getMessage(), sourceName, e);
        }
    }

    private List<Token> readLabels(Document document) {
        List<Token> labels = new ArrayList<>();
        NodeList texts = document.getElementsByTagNameNS("*", "text");
        for (int i = 0; i < texts.getLength(); i++) {
            Element text = (Element) texts.item(i);
            String content = text.getTextContent();
            Matcher position = MATRIX_POSITION.matcher(text.getAttribute("transform"));
            if (content == null || content.isBlank() || !position.find()) {
                continue;
            }
            labels.add(Token.of(content, Double.parseDouble(position.group(1)), Double.parseDouble(position.group(2))));
        }
        return labels;
    }

    /**
     * All polylines, minus outline duplicates that trace the same wire.
     */
    private List<Polyline> readPolylines(Document document) {
        List<Polyline> polylines = new ArrayList<>();
        NodeList elements = document.getElementsByTagNameNS("*", "polyline");
        for (int i = 0; i < elements.getLength(); i++) {
            Element element = (Element) elements.item(i);
            Optional<Polyline> polyline = PathDataParser.parsePoints(element.getAttribute("points"));
            if (polyline.isEmpty()) {
                continue;
            }
            if (polylines.stream().noneMatch(existing -> nearlyIdentical(existing, polyline.get()))) {
                polylines.add(polyline.get());
            }
        }
        return polylines;
    }

    private boolean nearlyIdentical(Polyline a, Polyline b) {
        if (a.size() != b.size()) {
            return false;
        }
        double tolerance = conventions.getPolylineDuplicateTolerance();
        for (int i = 0; i < a.size(); i++) {
            Point p = a.get(i);
            Point q = b.get(i);
            if (Math.abs(p.x() - q.x()) + Math.abs(p.y() - q.y()) > tolerance) {
                return false;
            }
        }
        return true;
    }

    private Optional<Point> spliceDot(String data) {
        if (data.length() > conventions.getSpliceDotMaxPathLength()) {
            return Optional.empty();
        }
        long curves = data.chars().filter(c -> c == 'c' || c == 'C').count();
        if (curves < conventions.getSpliceDotMinCurveCommands()) {
            return Optional.empty();
        }
        return PathDataParser.parsePath(data).map(Polyline::first);
    }

    private static boolean hasVerticalRun(String data) {
        return data.indexOf('v') >= 0 || data.indexOf('V') >= 0;
    }
}
