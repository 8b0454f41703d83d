package com.purchasingpower.wiregraph.geometry;

import com.purchasingpower.wiregraph.config.DiagramConventions;
import com.purchasingpower.wiregraph.core.Point;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places splice labels on the dots they describe and names unlabeled dots.
 *
 * <p>Splice labels are printed offset from the dot, while wires end at the dot itself.
 * Dots without a label nearby get generated IDs {@code SP_CUSTOM_001},
 * {@code SP_CUSTOM_002}, ... numbered in document order.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpliceDotMapper {

    private final DiagramConventions conventions;

    public List<Token> apply(List<Token> labels, List<Point> dots) {
        List<Token> placed = moveLabelsOntoDots(labels, dots);
        return nameUnlabeledDots(placed, dots);
    }

    List<Token> moveLabelsOntoDots(List<Token> labels, List<Point> dots) {
        double radius = conventions.getSpliceLabelRadius();
        List<Token> placed = new ArrayList<>();
        for (Token label : labels) {
            if (label.kind() != TokenKind.SPLICE) {
                placed.add(label);
                continue;
            }
            Point nearest = null;
            double best = radius;
            for (Point dot : dots) {
                double distance = dot.distanceTo(label.x(), label.y());
                if (distance < best) {
                    best = distance;
                    nearest = dot;
                }
            }
            placed.add(nearest != null ? Token.of(label.content(), nearest.x(), nearest.y()) : label);
        }
        return placed;
    }

    List<Token> nameUnlabeledDots(List<Token> labels, List<Point> dots) {
        double radius = conventions.getSpliceLabelRadius();
        List<Token> splices = labels.stream().filter(label -> label.kind() == TokenKind.SPLICE).toList();
        Map<String, String> generated = new LinkedHashMap<>();
        List<Token> result = new ArrayList<>(labels);

        for (Point dot : dots) {
            boolean labelled = splices.stream().anyMatch(splice -> dot.distanceTo(splice.x(), splice.y()) < radius);
            if (labelled) {
                continue;
            }
            String key = Math.round(dot.x() * 100) + ":" + Math.round(dot.y() * 100);
            if (generated.containsKey(key)) {
                continue;
            }
            String id = String.format("%s%03d", TokenKind.CUSTOM_SPLICE_PREFIX, generated.size() + 1);
            generated.put(key, id);
            result.add(Token.of(id, dot.x(), dot.y()));
        }

        if (!generated.isEmpty()) {
            log.info("Generated {} IDs for unlabeled splice dots", generated.size());
        }
        return result;
    }
}
