package harvester.coordinator.split;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Newline-delimited text input, one target identifier per line.
 * Blank lines are skipped; surrounding whitespace is trimmed.
 */
public class LineInputSource implements InputSource {

    private final BufferedReader reader;
    private final String ref;

    public LineInputSource(Reader reader, String ref) {
        this.reader = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        this.ref = ref;
    }

    public static LineInputSource open(Path path) throws IOException {
        return new LineInputSource(Files.newBufferedReader(path, StandardCharsets.UTF_8), path.toString());
    }

    @Override
    public String nextRow() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            String row = line.strip();
            if (!row.isEmpty()) {
                return row;
            }
        }
        return null;
    }

    @Override
    public String describe() {
        return ref;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
