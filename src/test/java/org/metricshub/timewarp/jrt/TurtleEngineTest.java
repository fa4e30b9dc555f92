package org.metricshub.timewarp.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TurtleEngineTest {

	private static final double DELTA = 1e-9;

	private static TurtleEngine.TurtleResult apply(TurtleState state, TurtleCommand command) {
		return TurtleEngine.apply(state, command);
	}

	@Test
	public void testForwardFollowsHeading() {
		TurtleEngine.TurtleResult north = apply(TurtleState.HOME, TurtleCommand.of(TurtleCommand.Op.FORWARD, 50));
		assertEquals(0d, north.getState().getX(), DELTA);
		assertEquals(50d, north.getState().getY(), DELTA);
		assertEquals("LINE 0,0 -> 0,50 black", north.getPrimitives().get(0).toString());

		TurtleState east = apply(TurtleState.HOME, TurtleCommand.of(TurtleCommand.Op.RIGHT, 90)).getState();
		TurtleEngine.TurtleResult moved = apply(east, TurtleCommand.of(TurtleCommand.Op.FORWARD, 10));
		assertEquals(10d, moved.getState().getX(), DELTA);
		assertEquals(0d, moved.getState().getY(), DELTA);
		assertEquals("LINE 0,0 -> 10,0 black", moved.getPrimitives().get(0).toString());
	}

	@Test
	public void testBackMovesAgainstHeading() {
		TurtleState state = apply(TurtleState.HOME, TurtleCommand.of(TurtleCommand.Op.BACK, 20)).getState();
		assertEquals(-20d, state.getY(), DELTA);
		assertEquals(0d, state.getHeading(), DELTA);
	}

	@Test
	public void testHeadingIsNormalized() {
		TurtleState state = apply(TurtleState.HOME, TurtleCommand.of(TurtleCommand.Op.LEFT, 90)).getState();
		assertEquals(270d, state.getHeading(), DELTA);
		state = apply(state, TurtleCommand.of(TurtleCommand.Op.RIGHT, 450)).getState();
		assertEquals(0d, state.getHeading(), DELTA);
		state = apply(state, TurtleCommand.of(TurtleCommand.Op.SETHEADING, -45)).getState();
		assertEquals(315d, state.getHeading(), DELTA);
	}

	@Test
	public void testPenUpMovesWithoutDrawing() {
		TurtleState up = apply(TurtleState.HOME, TurtleCommand.of(TurtleCommand.Op.PENUP)).getState();
		assertFalse(up.isPenDown());
		TurtleEngine.TurtleResult moved = apply(up, TurtleCommand.of(TurtleCommand.Op.SETXY, 3, 4));
		assertTrue(moved.getPrimitives().isEmpty());
		assertEquals(3d, moved.getState().getX(), DELTA);
		assertEquals(4d, moved.getState().getY(), DELTA);
		assertTrue(apply(moved.getState(), TurtleCommand.of(TurtleCommand.Op.CIRCLE, 5)).getPrimitives().isEmpty());
	}

	@Test
	public void testPenAttributes() {
		TurtleState state = apply(TurtleState.HOME, TurtleCommand.color("red")).getState();
		state = apply(state, TurtleCommand.of(TurtleCommand.Op.SETPENSIZE, 3)).getState();
		DrawPrimitive circle = apply(state, TurtleCommand.of(TurtleCommand.Op.CIRCLE, -7)).getPrimitives().get(0);
		assertEquals(DrawPrimitive.Kind.CIRCLE, circle.getKind());
		assertEquals(7d, circle.getRadius(), DELTA);
		assertEquals("red", circle.getColor());
		assertEquals(3d, circle.getWidth(), DELTA);
		assertEquals("CIRCLE 0,0 r=7 red", circle.toString());
	}

	@Test
	public void testHomeDrawsBackToOrigin() {
		TurtleState state = apply(TurtleState.HOME, TurtleCommand.of(TurtleCommand.Op.RIGHT, 30)).getState();
		state = apply(state, TurtleCommand.of(TurtleCommand.Op.SETXY, 30, 40)).getState();
		TurtleEngine.TurtleResult home = apply(state, TurtleCommand.of(TurtleCommand.Op.HOME));
		assertEquals("LINE 30,40 -> 0,0 black", home.getPrimitives().get(0).toString());
		assertEquals(0d, home.getState().getHeading(), DELTA);
	}

	@Test
	public void testClearScreenResetsPositionButKeepsPen() {
		TurtleState state = apply(TurtleState.HOME, TurtleCommand.color("blue")).getState();
		state = apply(state, TurtleCommand.of(TurtleCommand.Op.FORWARD, 10)).getState();
		TurtleEngine.TurtleResult cleared = apply(state, TurtleCommand.of(TurtleCommand.Op.CLEARSCREEN));
		assertEquals(DrawPrimitive.Kind.CLEAR, cleared.getPrimitives().get(0).getKind());
		assertEquals("CLEAR", cleared.getPrimitives().get(0).toString());
		assertEquals(0d, cleared.getState().getY(), DELTA);
		assertEquals("blue", cleared.getState().getPenColor());
	}

	@Test
	public void testVisibility() {
		TurtleState hidden = apply(TurtleState.HOME, TurtleCommand.of(TurtleCommand.Op.HIDETURTLE)).getState();
		assertFalse(hidden.isVisible());
		assertTrue(apply(hidden, TurtleCommand.of(TurtleCommand.Op.SHOWTURTLE)).getState().isVisible());
	}

	@Test
	public void testInitialState() {
		assertEquals("Turtle[x=0, y=0, heading=0, pen=down, color=black]", TurtleState.HOME.toString());
		assertEquals(1d, TurtleState.HOME.getPenSize(), DELTA);
		assertEquals(2, TurtleCommand.Op.SETXY.arity());
	}
}
