package at.sv.chroma.color;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads palettes from JSON documents of the form:
 * <pre>
 * {"entries": [{"label": "RED", "hue": 0}, {"label": "PURPLE", "hue": 250}]}
 * </pre>
 * The entry order of the document is kept.
 */
@Slf4j
public final class PaletteLoader {

    private final ObjectMapper mapper;

    public PaletteLoader() {
        mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public Palette load(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new InvalidPaletteException("Could not read palette file '" + file + "': " + e.getMessage(), e);
        }
        Palette palette = parse(json);
        log.debug("Loaded {} palette entries from {}", palette.getEntries().size(), file);
        return palette;
    }

    public Palette parse(String json) {
        PaletteDocument document;
        try {
            document = mapper.readValue(json, PaletteDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidPaletteException("Invalid palette document: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.entries == null) {
            throw new InvalidPaletteException("Palette document has no 'entries' list");
        }
        List<PaletteEntry> entries = new ArrayList<>();
        for (int i = 0; i < document.entries.size(); i++) {
            entries.add(toEntry(i, document.entries.get(i)));
        }
        return Palette.of(entries);
    }

    private static PaletteEntry toEntry(int index, EntryDocument entry) {
        if (entry == null || entry.label == null || entry.hue == null) {
            throw new InvalidPaletteException("Palette entry " + index + " requires 'label' and 'hue'");
        }
        ColorLabel label = ColorLabel.parse(entry.label);
        if (label == null) {
            throw new InvalidPaletteException("Palette entry " + index + " has unknown label '" + entry.label + "'");
        }
        try {
            return PaletteEntry.of(label, entry.hue);
        } catch (IllegalArgumentException e) {
            throw new InvalidPaletteException("Palette entry " + index + " is invalid: " + e.getMessage(), e);
        }
    }

    @Data
    @NoArgsConstructor
    static final class PaletteDocument {
        List<EntryDocument> entries;
    }

    @Data
    @NoArgsConstructor
    static final class EntryDocument {
        String label;
        Double hue;
    }
}
