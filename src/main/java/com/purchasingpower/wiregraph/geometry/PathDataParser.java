package com.purchasingpower.wiregraph.geometry;

import com.purchasingpower.wiregraph.core.Point;
import com.purchasingpower.wiregraph.core.Polyline;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flattens SVG path data and polyline point lists into vertex lists.
 *
 * <p>Supports {@code M m L l H h V v C c Z z}. Curves contribute their end point only.
 * Malformed input yields an empty result rather than an error.
 *
 * @since 1.0.0
 */
public final class PathDataParser {

    private static final Pattern COMMAND = Pattern.compile("[MmLlHhVvCcSsQqTtAaZz][^MmLlHhVvCcSsQqTtAaZz]*");
    private static final Pattern NUMBER = Pattern.compile("-?\\d*\\.?\\d+(?:[eE][-+]?\\d+)?");

    private PathDataParser() {
    }

    /**
     * Vertices of a path {@code d} attribute, or empty when it does not start with a move.
     */
    public static Optional<Polyline> parsePath(String data) {
        if (data == null || data.isBlank()) {
            return Optional.empty();
        }

        List<String> commands = new ArrayList<>();
        Matcher matcher = COMMAND.matcher(data.trim());
        while (matcher.find()) {
            commands.add(matcher.group());
        }
        if (commands.isEmpty() || Character.toUpperCase(commands.get(0).charAt(0)) != 'M') {
            return Optional.empty();
        }

        List<Double> start = numbers(commands.get(0).substring(1));
        if (start.size() < 2) {
            return Optional.empty();
        }
        double startX = start.get(0);
        double startY = start.get(1);
        double x = startX;
        double y = startY;

        List<Point> points = new ArrayList<>();
        points.add(new Point(x, y));

        for (String command : commands.subList(1, commands.size())) {
            char op = command.charAt(0);
            List<Double> params = numbers(command.substring(1));
            int n = params.size();

            switch (op) {
                case 'M':
                case 'L':
                    if (n >= 2) {
                        x = params.get(n - 2);
                        y = params.get(n - 1);
                        points.add(new Point(x, y));
                    }
                    break;
                case 'm':
                case 'l':
                    if (n >= 2) {
                        x += params.get(n - 2);
                        y += params.get(n - 1);
                        points.add(new Point(x, y));
                    }
                    break;
                case 'H':
                    if (n >= 1) {
                        x = params.get(n - 1);
                        points.add(new Point(x, y));
                    }
                    break;
                case 'h':
                    if (n >= 1) {
                        x += params.get(n - 1);
                        points.add(new Point(x, y));
                    }
                    break;
                case 'V':
                    if (n >= 1) {
                        y = params.get(n - 1);
                        points.add(new Point(x, y));
                    }
                    break;
                case 'v':
                    if (n >= 1) {
                        y += params.get(n - 1);
                        points.add(new Point(x, y));
                    }
                    break;
                case 'C':
                    if (n >= 6) {
                        x = params.get(n - 2);
                        y = params.get(n - 1);
                        points.add(new Point(x, y));
                    }
                    break;
                case 'c':
                    if (n >= 6) {
                        x += params.get(n - 2);
                        y += params.get(n - 1);
                        points.add(new Point(x, y));
                    }
                    break;
                case 'Z':
                case 'z':
                    x = startX;
                    y = startY;
                    points.add(new Point(x, y));
                    break;
                default:
                    // Other curve types are not used by the drawing tool for wires
                    break;
            }
        }
        return Optional.of(new Polyline(points));
    }

    /**
     * Points of a polyline {@code points} attribute ({@code "x1,y1 x2,y2"}), or empty
     * when fewer than two points can be read.
     */
    public static Optional<Polyline> parsePoints(String data) {
        if (data == null) {
            return Optional.empty();
        }
        List<Double> values = numbers(data);
        if (values.size() < 4 || values.size() % 2 != 0) {
            return Optional.empty();
        }
        List<Point> points = new ArrayList<>();
        for (int i = 0; i < values.size(); i += 2) {
            points.add(new Point(values.get(i), values.get(i + 1)));
        }
        return Optional.of(new Polyline(points));
    }

    private static List<Double> numbers(String text) {
        List<Double> values = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            values.add(Double.parseDouble(matcher.group()));
        }
        return values;
    }
}
