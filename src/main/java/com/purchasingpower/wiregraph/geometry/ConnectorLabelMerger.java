package com.purchasingpower.wiregraph.geometry;

import com.purchasingpower.wiregraph.config.DiagramConventions;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Joins connector labels that the drawing tool split into several text elements.
 *
 * <p>First, option labels such as {@code (XR-)} are appended to the connector printed
 * just left of them. Then stacked {@code (XR-)}/{@code (XR+)} connectors of a shielded
 * pair become one two-line label at their mean X, {@code XR-} line first.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectorLabelMerger {

    private static final Pattern OPTION_LABEL = Pattern.compile("^\\([A-Z]+[+-]\\)$");
    private static final String SHIELD_MINUS = "(XR-)";
    private static final String SHIELD_PLUS = "(XR+)";

    private final DiagramConventions conventions;

    public List<Token> merge(List<Token> labels) {
        List<Token> withOptions = attachOptionLabels(labels);
        return joinShieldedPairs(withOptions);
    }

    private List<Token> attachOptionLabels(List<Token> labels) {
        Map<Integer, Integer> optionOwner = new HashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            Token option = labels.get(i);
            if (!OPTION_LABEL.matcher(option.content()).matches()) {
                continue;
            }
            for (int j = 0; j < labels.size(); j++) {
                Token owner = labels.get(j);
                if (j != i
                    && owner.kind().isConnectorLike()
                    && owner.x() < option.x()
                    && option.x() - owner.x() < conventions.getOptionLabelMaxXDistance()
                    && Math.abs(owner.y() - option.y()) < conventions.getOptionLabelYTolerance()) {
                    optionOwner.put(i, j);
                    break;
                }
            }
        }

        Map<Integer, Integer> ownerOption = new HashMap<>();
        optionOwner.forEach((option, owner) -> ownerOption.putIfAbsent(owner, option));

        List<Token> merged = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            Token label = labels.get(i);
            if (optionOwner.containsKey(i) && ownerOption.get(optionOwner.get(i)) == i) {
                continue;
            }
            Integer option = ownerOption.get(i);
            if (option != null) {
                merged.add(Token.of(label.content() + " " + labels.get(option).content(), label.x(), label.y()));
            } else {
                merged.add(label);
            }
        }
        return merged;
    }

    private List<Token> joinShieldedPairs(List<Token> labels) {
        Set<Integer> used = new HashSet<>();
        List<Token> merged = new ArrayList<>();

        for (int i = 0; i < labels.size(); i++) {
            if (used.contains(i)) {
                continue;
            }
            Token label = labels.get(i);
            if (!isShielded(label)) {
                merged.add(label);
                continue;
            }

            Token pair = null;
            for (int j = i + 1; j < labels.size(); j++) {
                Token other = labels.get(j);
                if (used.contains(j) || !isShielded(other)) {
                    continue;
                }
                double xGap = Math.abs(other.x() - label.x());
                double yGap = Math.abs(other.y() - label.y());
                boolean stacked = xGap < conventions.getShieldedPairMaxXDistance()
                    && conventions.getShieldedPairMinYGap() < yGap
                    && yGap < conventions.getShieldedPairMaxYGap();
                boolean opposite = label.content().contains(SHIELD_MINUS) != other.content().contains(SHIELD_MINUS);
                if (stacked && opposite) {
                    pair = other;
                    used.add(j);
                    break;
                }
            }

            if (pair == null) {
                merged.add(label);
                continue;
            }
            Token minus = label.content().contains(SHIELD_MINUS) ? label : pair;
            Token plus = minus == label ? pair : label;
            Token joined = Token.of(minus.content() + "\n" + plus.content(), (label.x() + pair.x()) / 2, minus.y());
            log.debug("Joined shielded pair {}", joined.content().replace('\n', '/'));
            merged.add(joined);
        }
        return merged;
    }

    private static boolean isShielded(Token label) {
        return label.kind() == TokenKind.CONNECTOR
            && (label.content().endsWith(" " + SHIELD_MINUS) || label.content().endsWith(" " + SHIELD_PLUS));
    }
}
