package edu.stanford.nlp.strongsup.tangrams.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertTrue;

import edu.stanford.nlp.strongsup.BadProgramException;
import edu.stanford.nlp.strongsup.tangrams.Operation;
import edu.stanford.nlp.strongsup.tangrams.Position;
import edu.stanford.nlp.strongsup.tangrams.Program;
import org.testng.annotations.Test;

/**
 * Test programs and their textual form.
 */
public class ProgramTest
{
	@Test
	public void parse()
	{
		final Program p = Program.fromString("move(1, 3, 0)  rotate(2,1) add(B,0,0) stop");
		assertEquals(4, p.size());
		assertEquals(3, p.length());
		assertTrue(p.isTerminated());
		assertEquals(new Operation.Move(1, Position.of(3, 0)), p.get(0));
		assertEquals(new Operation.Rotate(2, 1), p.get(1));
		assertEquals(new Operation.Add("B", Position.of(0, 0)), p.get(2));
		assertEquals(Operation.STOP, p.get(3));
		assertEquals("move(1,3,0) rotate(2,1) add(B,0,0) stop", p.toString());
		assertEquals(p, Program.fromString(p.toString()));
	}

	@Test
	public void appendAndLength()
	{
		Program p = Program.EMPTY;
		assertFalse(p.isTerminated());
		p = p.append(new Operation.Swap(1, 2)).append(new Operation.Remove(1));
		assertEquals(2, p.length());
		p = p.append(Operation.STOP);
		assertEquals(2, p.length());
		assertEquals(3, p.size());
	}

	@Test(expectedExceptions = BadProgramException.class)
	public void cannotExtendTerminatedProgram()
	{
		Program.of(Operation.STOP).append(new Operation.Remove(1));
	}

	@Test(expectedExceptions = BadProgramException.class)
	public void stopOnlyLast()
	{
		Program.of(Operation.STOP, new Operation.Remove(1)).validate();
	}

	@Test(expectedExceptions = BadProgramException.class)
	public void unknownOperation()
	{
		Program.fromString("fly(1,2)");
	}

	@Test(expectedExceptions = BadProgramException.class)
	public void wrongArity()
	{
		Program.fromString("move(1,2)");
	}

	@Test(expectedExceptions = BadProgramException.class)
	public void trailingGarbage()
	{
		Program.fromString("remove(1) stop)");
	}
}
