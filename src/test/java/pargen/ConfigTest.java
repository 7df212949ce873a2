package pargen;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.logging.Level;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@AfterEach
	public void reset(){
		Config.set("synthesizeFactoring", "no");
		Config.set("logLevel", "INFO");
		Config.set("sentenceLength", "0");
		System.clearProperty("pargen.sentenceLength");
	}

	@Test
	public void testDefaults(){
		assertFalse(Config.synthesizeFactoring());
		assertEquals(Level.INFO, Config.getLogLevel());
		assertEquals(0, Config.getSentenceLength());
	}

	@Test
	public void testLoadConfig(@TempDir Path dir) throws IOException {
		Path file = dir.resolve(Config.configFile);
		Files.write(file, Arrays.asList("synthesizeFactoring = yes", "logLevel = FINER", "unknown = 1", "no assignment"));
		Config.loadConfig(file.toFile());
		assertTrue(Config.synthesizeFactoring());
		assertEquals(Level.FINER, Config.getLogLevel());
	}

	@Test
	public void testMissingFileIsIgnored(@TempDir Path dir){
		Config.loadConfig(new File(dir.toFile(), "missing.ini"));
		assertFalse(Config.synthesizeFactoring());
	}

	@Test
	public void testSystemPropertyTakesPrecedence(){
		Config.set("sentenceLength", "2");
		System.setProperty("pargen.sentenceLength", "4");
		assertEquals(4, Config.getSentenceLength());
	}

	@Test
	public void testInvalidValues(){
		Config.set("logLevel", "LOUD");
		assertEquals(Level.INFO, Config.getLogLevel());
		Config.set("sentenceLength", "many");
		assertThrows(PargenException.class, Config::getSentenceLength);
	}

	@Test
	public void testUnknownKey(){
		assertThrows(PargenException.class, () -> Config.get("colors"));
		assertThrows(PargenException.class, () -> Config.set("colors", "yes"));
	}
}
