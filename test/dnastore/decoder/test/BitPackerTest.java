package dnastore.decoder.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import junit.framework.TestCase;
import dnastore.decoder.BitPacker;

public class BitPackerTest extends TestCase {

	private byte [] pack(String symbols, boolean msb0, StateClosureDecoderTest.RecordingHandler handler) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		BitPacker packer = new BitPacker(out, msb0);
		if(handler!=null) packer.setLog(StateClosureDecoderTest.createLogger(handler));
		for(int i=0;i<symbols.length();i++) packer.write(symbols.charAt(i));
		packer.close();
		return out.toByteArray();
	}

	public void testLeastSignificantBitFirst() throws IOException {
		byte [] packed = pack("10101010", false, null);
		assertEquals(1, packed.length);
		assertEquals(0x55, packed[0] & 0xFF);
	}

	public void testMostSignificantBitFirst() throws IOException {
		byte [] packed = pack("10101010", true, null);
		assertEquals(1, packed.length);
		assertEquals(0xAA, packed[0] & 0xFF);
	}

	public void testSeveralBytes() throws IOException {
		byte [] packed = pack("1000000011111111", false, null);
		assertEquals(2, packed.length);
		assertEquals(1, packed[0] & 0xFF);
		assertEquals(0xFF, packed[1] & 0xFF);
	}

	public void testPendingBitsAreDiscarded() throws IOException {
		StateClosureDecoderTest.RecordingHandler handler = new StateClosureDecoderTest.RecordingHandler();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		BitPacker packer = new BitPacker(out);
		packer.setLog(StateClosureDecoderTest.createLogger(handler));
		packer.write('1');
		packer.write('0');
		packer.write('1');
		assertEquals(3, packer.getPendingBits());
		packer.close();
		assertEquals(0, packer.getPendingBits());
		assertEquals(0, out.size());
		assertEquals(1, handler.countWarnings());
		LogRecord record = handler.getRecords().get(0);
		assertTrue(record.getMessage().contains("3 bits"));
	}

	public void testOtherSymbolsAreDiscarded() throws IOException {
		StateClosureDecoderTest.RecordingHandler handler = new StateClosureDecoderTest.RecordingHandler();
		byte [] packed = pack("^1010B1010$", false, handler);
		assertEquals(1, packed.length);
		assertEquals(0x55, packed[0] & 0xFF);
		//Only the control symbol produces a warning
		assertEquals(1, handler.countWarnings());
		int fine = 0;
		for(LogRecord r:handler.getRecords()) if(r.getLevel()==Level.FINE) fine++;
		assertEquals(2, fine);
	}

	public void testUnknownSymbol() throws IOException {
		StateClosureDecoderTest.RecordingHandler handler = new StateClosureDecoderTest.RecordingHandler();
		byte [] packed = pack("x", false, handler);
		assertEquals(0, packed.length);
		assertEquals(1, handler.countWarnings());
	}
}
