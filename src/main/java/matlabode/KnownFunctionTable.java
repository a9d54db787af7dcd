package matlabode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Fixed table of names MATLAB resolves to functions when no variable of the
 * same name is in scope. Lookups are exact and case-sensitive.
 *
 * The table is a classpath resource with one name per line. Lines starting
 * with "#" are comments; the first one names the MATLAB release the list was
 * taken from ("# version: MATLAB R2014b").
 */
public final class KnownFunctionTable {

    private static final Logger log = LoggerFactory.getLogger(KnownFunctionTable.class);

    private static final String VERSION_PREFIX = "# version:";

    private static volatile KnownFunctionTable standard;

    private final Set<String> names;
    private final String version;

    public KnownFunctionTable(Collection<String> names, String version) {
        this.names = Collections.unmodifiableSet(new HashSet<>(names));
        this.version = version;
    }

    /** The bundled table, loaded on first use. */
    public static KnownFunctionTable standard() {
        KnownFunctionTable table = standard;
        if (table == null) {
            synchronized (KnownFunctionTable.class) {
                table = standard;
                if (table == null) {
                    table = load(ConverterConfiguration.DEFAULT_KNOWN_FUNCTIONS_RESOURCE);
                    standard = table;
                }
            }
        }
        return table;
    }

    public static KnownFunctionTable load(String resource) {
        InputStream in = KnownFunctionTable.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalStateException("Known function table not found on classpath: " + resource);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read known function table " + resource, e);
        }
    }

    static KnownFunctionTable read(BufferedReader reader) throws IOException {
        Set<String> names = new HashSet<>();
        String version = "unknown";
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.startsWith(VERSION_PREFIX)) {
                version = line.substring(VERSION_PREFIX.length()).trim();
            } else if (!line.isEmpty() && !line.startsWith("#")) {
                names.add(line);
            }
        }
        log.debug("Loaded {} known function names ({})", names.size(), version);
        return new KnownFunctionTable(names, version);
    }

    /** This table plus {@code extra}, or this table itself when nothing is new. */
    public KnownFunctionTable withNames(Collection<String> extra) {
        if (names.containsAll(extra)) {
            return this;
        }
        Set<String> merged = new HashSet<>(names);
        merged.addAll(extra);
        return new KnownFunctionTable(merged, version);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public String getVersion() {
        return version;
    }

    public int size() {
        return names.size();
    }
}
