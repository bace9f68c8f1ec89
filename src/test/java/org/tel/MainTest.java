package org.tel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tel.formula.FormulaParser;
import org.tel.horizon.HorizonManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test della linea di comando: validazione dei parametri e rendering delle regole.
 */
public class MainTest {

    @TempDir
    Path tempDir;

    private Path writeProgram(String content) throws IOException {
        Path file = tempDir.resolve("programma.tel");
        Files.writeString(file, content);
        return file;
    }

    @Test
    public void testParseFileArguments() throws IOException {
        Path file = writeProgram("#always a.\n");
        Main.TranslatorConfiguration config = new Main.ArgumentParser()
                .parse(new String[]{"-f", file.toString(), "-n", "5", "-t", "30", "-open"});

        assertTrue(config.isFileMode);
        assertEquals(file.toString(), config.inputPath);
        assertEquals(5, config.steps);
        assertEquals(30, config.timeoutSeconds);
        assertTrue(config.leaveOpen);
        assertNull(config.outputPath);
    }

    @Test
    public void testDefaults() throws IOException {
        Main.TranslatorConfiguration config = new Main.ArgumentParser()
                .parse(new String[]{"-d", tempDir.toString()});

        assertFalse(config.isFileMode);
        assertEquals(3, config.steps);
        assertEquals(10, config.timeoutSeconds);
        assertFalse(config.leaveOpen);
    }

    @Test
    public void testInvalidArguments() throws IOException {
        Path file = writeProgram("#always a.\n");
        Main.ArgumentParser parser = new Main.ArgumentParser();

        assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-n", "3"}),
                "Manca l'input");
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse(new String[]{"-f", file.toString(), "-n", "0"}));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse(new String[]{"-f", file.toString(), "-t", "dieci"}));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse(new String[]{"-f", file.toString(), "-d", tempDir.toString()}),
                "File e directory sono mutualmente esclusivi");
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse(new String[]{"-f", tempDir.resolve("assente.tel").toString()}));
        assertThrows(IllegalArgumentException.class, () -> parser.parse(new String[]{"-x"}));
        assertNull(parser.parse(new String[]{"-h"}), "L'help non produce una configurazione");
    }

    @Test
    public void testRenderRules() throws IOException {
        Path file = writeProgram("#always a -> > b.\n");
        HorizonManager manager = new HorizonManager(FormulaParser.parseProgram(Files.readString(file)));
        manager.extendHorizon();
        manager.extendHorizon();

        Main.TranslatorConfiguration config = new Main.TranslatorConfiguration(
                file.toString(), null, true, 2, 10, true);
        String output = Main.renderRules(manager, config);

        assertTrue(output.startsWith("% Programma tradotto da programma.tel"));
        assertTrue(output.contains("% passo 0\n"));
        assertTrue(output.contains("% passo 1\n"));
        assertTrue(output.contains("not a(0)"), output);
        assertTrue(output.contains("#external __ext("), "L'orizzonte aperto lascia un esterno libero");
        assertTrue(output.contains("{ a(0); b(1); a(1) }."), output);
        assertFalse(output.contains("% chiusura"));

        manager.markFinal(1);
        String closed = Main.renderRules(manager, config);
        assertTrue(closed.contains("% chiusura al passo 1\n"));
        assertFalse(closed.contains("#external"), "Alla chiusura non restano esterni liberi");
    }
}
