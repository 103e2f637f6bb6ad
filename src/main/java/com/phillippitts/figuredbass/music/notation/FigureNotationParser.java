package com.phillippitts.figuredbass.music.notation;

import com.phillippitts.figuredbass.exception.InvalidNotationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link NotationService} for thoroughbass figures.
 *
 * <p>Each comma-separated figure is a number with an optional modifier before or after it
 * ({@code "#6"}, {@code "6#"}); a modifier standing alone applies to the third. Common
 * abbreviations are expanded to longhand:
 * <pre>
 * ""  / "5"  -> 5,3        "6,5" -> 6,5,3
 * "6"        -> 6,3        "4,3" -> 6,4,3
 * "7"        -> 7,5,3      "4,2" / "2" -> 6,4,2
 * "9" / "11" / "13"        -> full stack of thirds
 * </pre>
 * Modifiers on an abbreviated figure stay attached to the same number after expansion.
 */
@Component
public class FigureNotationParser implements NotationService {

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern NON_DIGITS = Pattern.compile("[^0-9]+");

    // 0 stands for a figure that has a modifier but no number
    private static final Map<List<Integer>, List<Integer>> SHORTHAND = Map.ofEntries(
            Map.entry(List.of(0), List.of(5, 3)),
            Map.entry(List.of(5), List.of(5, 3)),
            Map.entry(List.of(6), List.of(6, 3)),
            Map.entry(List.of(7), List.of(7, 5, 3)),
            Map.entry(List.of(9), List.of(9, 7, 5, 3)),
            Map.entry(List.of(11), List.of(11, 9, 7, 5, 3)),
            Map.entry(List.of(13), List.of(13, 11, 9, 7, 5, 3)),
            Map.entry(List.of(6, 5), List.of(6, 5, 3)),
            Map.entry(List.of(4, 3), List.of(6, 4, 3)),
            Map.entry(List.of(4, 2), List.of(6, 4, 2)),
            Map.entry(List.of(2), List.of(6, 4, 2))
    );

    @Override
    public Notation parseFigure(String figureString) {
        String source = figureString == null ? "" : figureString.strip();
        List<Integer> numbers = new ArrayList<>();
        List<Modifier> modifiers = new ArrayList<>();

        for (String part : source.split(",", -1)) {
            String figure = part.strip();
            List<String> digitGroups = groups(DIGITS, figure);
            List<String> modifierGroups = groups(NON_DIGITS, figure);
            if (digitGroups.size() > 1 || modifierGroups.size() > 1) {
                throw new InvalidNotationException(source, "figure '" + figure + "' has more than one number or modifier");
            }
            int number = digitGroups.isEmpty() ? 0 : Integer.parseInt(digitGroups.get(0));
            if (!digitGroups.isEmpty() && number < 1) {
                throw new InvalidNotationException(source, "figure number must be positive in '" + figure + "'");
            }
            numbers.add(number);
            modifiers.add(modifierGroups.isEmpty() ? Modifier.NONE : Modifier.fromSymbol(modifierGroups.get(0)));
        }
        return new Notation(source, toLonghand(numbers, modifiers));
    }

    private static List<Figure> toLonghand(List<Integer> numbers, List<Modifier> modifiers) {
        List<Integer> explicit = numbers.stream().map(n -> n == 0 ? 3 : n).toList();
        List<Integer> expanded = SHORTHAND.get(numbers);
        List<Figure> figures = new ArrayList<>();
        if (expanded == null) {
            for (int i = 0; i < explicit.size(); i++) {
                figures.add(new Figure(explicit.get(i), modifiers.get(i)));
            }
            return figures;
        }
        for (int number : expanded) {
            int index = explicit.indexOf(number);
            figures.add(new Figure(number, index >= 0 ? modifiers.get(index) : Modifier.NONE));
        }
        return figures;
    }

    private static List<String> groups(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String g = m.group().strip();
            if (!g.isEmpty()) {
                found.add(g);
            }
        }
        return found;
    }
}
