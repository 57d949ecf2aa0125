package at.sv.chroma.color;

import java.util.List;

import static at.sv.chroma.color.ColorLabel.*;

/**
 * Ordered list of reference hues the {@link PaletteClassifier} matches against. The order is significant: if
 * two entries are equally close to a hue, the first one wins.
 */
public final class Palette {

    private final List<PaletteEntry> entries;

    private Palette(List<PaletteEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Palette of(List<PaletteEntry> entries) {
        return new Palette(entries);
    }

    public static Palette of(PaletteEntry... entries) {
        return new Palette(List.of(entries));
    }

    /**
     * One reference hue per chromatic label.
     */
    public static Palette standard() {
        return of(
                PaletteEntry.of(RED, 0),
                PaletteEntry.of(ORANGE, 30),
                PaletteEntry.of(YELLOW, 55),
                PaletteEntry.of(SKY_BLUE, 195),
                PaletteEntry.of(PURPLE, 275)
        );
    }

    /**
     * Keeps sky blue narrow around cyan and maps the whole light blue to violet range to purple.
     */
    public static Palette purpleMerged() {
        return of(
                PaletteEntry.of(RED, 0),
                PaletteEntry.of(ORANGE, 25),
                PaletteEntry.of(YELLOW, 50),
                PaletteEntry.of(SKY_BLUE, 175),
                PaletteEntry.of(PURPLE, 210),
                PaletteEntry.of(PURPLE, 250),
                PaletteEntry.of(PURPLE, 290)
        );
    }

    public List<PaletteEntry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "Palette" + entries;
    }
}
