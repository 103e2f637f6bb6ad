package com.phillippitts.figuredbass.service.realize;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.domain.Progression;
import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Renders a progression as plain text, one line per voice, highest voice first:
 * <pre>
 * S: E4  F4  E4
 * A: C4  D4  C4
 * T: G3  A-3 G3
 * B: C3  B2  C3
 * </pre>
 */
@Component
public class ProgressionFormatter {

    public String format(Progression progression, VoiceEnsemble voices) {
        Objects.requireNonNull(progression, "progression");
        Objects.requireNonNull(voices, "voices");
        int width = 0;
        for (Possibility possibility : progression.possibilities()) {
            for (Pitch pitch : possibility.pitches()) {
                width = Math.max(width, pitch.nameWithOctave().length());
            }
        }
        int labelWidth = 0;
        for (String label : voices.labels()) {
            labelWidth = Math.max(labelWidth, label.length());
        }

        StringBuilder sb = new StringBuilder();
        for (int v = 0; v < voices.size(); v++) {
            sb.append(pad(voices.get(v).label(), labelWidth)).append(':');
            for (Pitch pitch : progression.voiceLine(v)) {
                sb.append(' ').append(pad(pitch.nameWithOctave(), width));
            }
            sb.setLength(sb.length() - trailingSpaces(sb));
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String pad(String text, int width) {
        StringBuilder sb = new StringBuilder(text);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }

    private static int trailingSpaces(StringBuilder sb) {
        int count = 0;
        for (int i = sb.length() - 1; i >= 0 && sb.charAt(i) == ' '; i--) {
            count++;
        }
        return count;
    }
}
