package matlabode;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class KnownFunctionTableTest {

    @Test
    void standardTableCoversSolversAndCommonFunctions() {
        KnownFunctionTable table = KnownFunctionTable.standard();
        for (String name : new String[] {"ode45", "ode15s", "ode23s", "odeset", "sin", "zeros", "linspace", "plot"}) {
            assertTrue(table.contains(name), name);
        }
        assertFalse(table.contains("foo"));
        assertEquals("MATLAB R2014b", table.getVersion());
        assertTrue(table.size() > 1000);
    }

    @Test
    void lookupsAreCaseSensitive() {
        assertFalse(KnownFunctionTable.standard().contains("Sin"));
        assertFalse(KnownFunctionTable.standard().contains("ODE45"));
    }

    @Test
    void standardTableIsLoadedOnce() {
        assertSame(KnownFunctionTable.standard(), KnownFunctionTable.standard());
    }

    @Test
    void readsNamesAndSkipsComments() throws Exception {
        String text = "# version: test 1\n# another comment\n\nalpha\n  beta  \n";
        KnownFunctionTable table = KnownFunctionTable.read(new BufferedReader(new StringReader(text)));
        assertEquals("test 1", table.getVersion());
        assertEquals(2, table.size());
        assertTrue(table.contains("alpha"));
        assertTrue(table.contains("beta"));
    }

    @Test
    void withNamesAddsOnlyWhatIsMissing() {
        KnownFunctionTable table = KnownFunctionTable.standard();
        assertSame(table, table.withNames(Arrays.asList("ode45", "sin")));
        KnownFunctionTable extended = table.withNames(Arrays.asList("ode5"));
        assertTrue(extended.contains("ode5"));
        assertTrue(extended.contains("ode45"));
        assertFalse(table.contains("ode5"));
        assertEquals(table.getVersion(), extended.getVersion());
    }

    @Test
    void parserKnowsConfiguredSolvers() {
        ConverterConfiguration configuration = new ConverterConfiguration();
        configuration.setSolverNames(Arrays.asList("ode45", "ode5"));
        assertTrue(new MatlabASTParser(configuration).getKnownFunctions().contains("ode5"));
    }

    @Test
    void missingResourceFailsFast() {
        assertThrows(IllegalStateException.class, () -> KnownFunctionTable.load("matlabode/no-such-table.txt"));
    }

    @Test
    void parserUsesConfiguredTable() throws Exception {
        ConverterConfiguration configuration = new ConverterConfiguration();
        configuration.setKnownFunctionsResource("matlabode/no-such-table.txt");
        assertThrows(IllegalStateException.class, () -> new MatlabASTParser(configuration));
    }
}
