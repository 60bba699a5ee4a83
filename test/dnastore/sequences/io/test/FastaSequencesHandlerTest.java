package dnastore.sequences.io.test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import junit.framework.TestCase;
import dnastore.sequences.QualifiedSequence;
import dnastore.sequences.io.FastaSequencesHandler;

public class FastaSequencesHandlerTest extends TestCase {
	private static final String FASTA = ">seq1 first sequence\nACGT\nac gt\n# comment\n>seq2\n\n>seq3\tother\nTTTT\n";

	public void testLoadSequences() throws IOException {
		FastaSequencesHandler handler = new FastaSequencesHandler();
		List<QualifiedSequence> sequences = handler.loadSequences(new ByteArrayInputStream(FASTA.getBytes(StandardCharsets.UTF_8)));
		assertEquals(3, sequences.size());
		assertEquals("seq1", sequences.get(0).getName());
		assertEquals("first sequence", sequences.get(0).getComments());
		assertEquals("ACGTACGT", sequences.get(0).getCharacters().toString());
		assertEquals("seq2", sequences.get(1).getName());
		assertEquals(0, sequences.get(1).getLength());
		assertNull(sequences.get(1).getComments());
		assertEquals("other", sequences.get(2).getComments());
		assertEquals("TTTT", sequences.get(2).getCharacters().toString());
	}

	public void testCompressedFile() throws IOException {
		File file = File.createTempFile("sequences", ".fa.gz");
		file.deleteOnExit();
		try (OutputStream out = new GZIPOutputStream(new FileOutputStream(file))) {
			out.write(FASTA.getBytes(StandardCharsets.UTF_8));
		}
		List<QualifiedSequence> sequences = new FastaSequencesHandler().loadSequences(file.getAbsolutePath());
		assertEquals(3, sequences.size());
		assertEquals("ACGTACGT", sequences.get(0).getCharacters().toString());
	}

	public void testSaveSequences() throws IOException {
		FastaSequencesHandler handler = new FastaSequencesHandler();
		List<QualifiedSequence> sequences = handler.loadSequences(new ByteArrayInputStream(FASTA.getBytes(StandardCharsets.UTF_8)));
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, "UTF-8");
		handler.saveSequences(sequences.subList(0, 1), out, 5);
		String expected = ">seq1 first sequence"+System.lineSeparator()+"ACGTA"+System.lineSeparator()+"CGT"+System.lineSeparator();
		assertEquals(expected, bytes.toString("UTF-8"));
	}

	public void testUTF8Comments() throws IOException {
		String fasta = ">seq1 r\u00e9plica \u03b1\nACGT\n";
		List<QualifiedSequence> sequences = new FastaSequencesHandler().loadSequences(new ByteArrayInputStream(fasta.getBytes(StandardCharsets.UTF_8)));
		assertEquals(1, sequences.size());
		assertEquals("r\u00e9plica \u03b1", sequences.get(0).getComments());
	}
}
