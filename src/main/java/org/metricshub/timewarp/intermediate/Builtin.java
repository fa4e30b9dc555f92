package org.metricshub.timewarp.intermediate;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Time Warp
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.Locale;
import java.util.Random;
import org.metricshub.timewarp.jrt.Operators;
import org.metricshub.timewarp.jrt.RuntimeErrorKind;
import org.metricshub.timewarp.jrt.TwRuntimeException;
import org.metricshub.timewarp.jrt.Value;

/**
 * Built-in functions of TW BASIC and TW Pascal. Each parser maps its own
 * spelling to these (BASIC {@code SQR} is {@link #SQRT}, Pascal
 * {@code sqr} is {@link #SQUARE}).
 * <p>
 * Character positions are 1-based, as in both languages.
 */
public enum Builtin {
	ABS(1, 1),
	INT(1, 1),
	TRUNC(1, 1),
	ROUND(1, 1),
	SQRT(1, 1),
	SQUARE(1, 1),
	SIN(1, 1),
	COS(1, 1),
	TAN(1, 1),
	ATN(1, 1),
	EXP(1, 1),
	LOG(1, 1),
	SGN(1, 1),
	ODD(1, 1),
	/** BASIC {@code RND}: a number in [0, 1); {@code RND(n)} with n &gt; 1 gives an integer in [1, n]. */
	RND(0, 1),
	/** Pascal {@code random}: a number in [0, 1), or an integer in [0, n). */
	RANDOM(0, 1),
	LEN(1, 1),
	VAL(1, 1),
	STR(1, 1),
	CHR(1, 1),
	ASC(1, 1),
	ORD(1, 1),
	LEFT(2, 2),
	RIGHT(2, 2),
	MID(2, 3),
	COPY(3, 3),
	POS(2, 2),
	UPPER(1, 1),
	LOWER(1, 1);

	private final int minArgs;
	private final int maxArgs;

	Builtin(int minArgs, int maxArgs) {
		this.minArgs = minArgs;
		this.maxArgs = maxArgs;
	}

	public boolean acceptsArgCount(int count) {
		return count >= minArgs && count <= maxArgs;
	}

	/**
	 * Evaluates the function.
	 *
	 * @param args arguments, already evaluated
	 * @param random generator of the run
	 * @return the result
	 */
	public Value apply(Value[] args, Random random) {
		switch (this) {
		case ABS:
			return Value.number(Math.abs(args[0].asNumber()));
		case INT:
			return Value.number(Math.floor(args[0].asNumber()));
		case TRUNC:
			return Value.number((double) (long) args[0].asNumber());
		case ROUND:
			return Value.number(roundHalfAwayFromZero(args[0].asNumber()));
		case SQRT:
			return Value.number(Math.sqrt(nonNegative(args[0].asNumber())));
		case SQUARE:
			return Value.number(args[0].asNumber() * args[0].asNumber());
		case SIN:
			return Value.number(Math.sin(args[0].asNumber()));
		case COS:
			return Value.number(Math.cos(args[0].asNumber()));
		case TAN:
			return Value.number(Math.tan(args[0].asNumber()));
		case ATN:
			return Value.number(Math.atan(args[0].asNumber()));
		case EXP:
			return Value.number(Math.exp(args[0].asNumber()));
		case LOG:
			double d = args[0].asNumber();
			if (d <= 0) {
				throw new TwRuntimeException(
						RuntimeErrorKind.ILLEGAL_ARGUMENT,
						"Logarithm of non-positive number " + Value.formatNumber(d));
			}
			return Value.number(Math.log(d));
		case SGN:
			return Value.number(Math.signum(args[0].asNumber()));
		case ODD:
			return Value.bool(Operators.toLong(args[0]) % 2 != 0);
		case RND:
			if (args.length == 1 && args[0].asNumber() > 1) {
				return Value.number(1 + random.nextInt((int) args[0].asNumber()));
			}
			return Value.number(random.nextDouble());
		case RANDOM:
			if (args.length == 1) {
				int bound = (int) args[0].asNumber();
				if (bound <= 0) {
					throw new TwRuntimeException(RuntimeErrorKind.ILLEGAL_ARGUMENT, "random needs a positive bound");
				}
				return Value.number(random.nextInt(bound));
			}
			return Value.number(random.nextDouble());
		case LEN:
			return Value.number(args[0].asText().length());
		case VAL:
			Double parsed = Operators.parseNumber(args[0].asText());
			return Value.number(parsed == null ? 0d : parsed.doubleValue());
		case STR:
			return Value.text(args[0].format());
		case CHR:
			return Value.text(String.valueOf((char) Operators.toLong(args[0])));
		case ASC:
			String s = args[0].asText();
			if (s.isEmpty()) {
				throw new TwRuntimeException(RuntimeErrorKind.ILLEGAL_ARGUMENT, "ASC of an empty text");
			}
			return Value.number(s.charAt(0));
		case ORD:
			if (args[0].isBoolean()) {
				return args[0].asBoolean() ? Value.ONE : Value.ZERO;
			}
			if (args[0].isText()) {
				return ASC.apply(args, random);
			}
			return Value.number(Operators.toLong(args[0]));
		case LEFT:
			return Value.text(left(args[0].asText(), count(args[1])));
		case RIGHT:
			String r = args[0].asText();
			int n = Math.min(count(args[1]), r.length());
			return Value.text(r.substring(r.length() - n));
		case MID:
			return Value.text(
					substring(args[0].asText(), count(args[1]), args.length > 2 ? count(args[2]) : Integer.MAX_VALUE));
		case COPY:
			return Value.text(substring(args[0].asText(), count(args[1]), count(args[2])));
		case POS:
			return Value.number(args[1].asText().indexOf(args[0].asText()) + 1);
		case UPPER:
			return Value.text(args[0].asText().toUpperCase(Locale.ROOT));
		case LOWER:
			return Value.text(args[0].asText().toLowerCase(Locale.ROOT));
		default:
			throw new IllegalStateException("Unhandled built-in " + this);
		}
	}

	private static double roundHalfAwayFromZero(double d) {
		return Math.signum(d) * Math.floor(Math.abs(d) + 0.5);
	}

	private static double nonNegative(double d) {
		if (d < 0) {
			throw new TwRuntimeException(
					RuntimeErrorKind.ILLEGAL_ARGUMENT,
					"Square root of negative number " + Value.formatNumber(d));
		}
		return d;
	}

	private static int count(Value value) {
		long n = Operators.toLong(value);
		if (n < 0) {
			throw new TwRuntimeException(RuntimeErrorKind.ILLEGAL_ARGUMENT, "Negative length " + n);
		}
		return (int) Math.min(n, Integer.MAX_VALUE);
	}

	private static String left(String s, int n) {
		return s.substring(0, Math.min(n, s.length()));
	}

	/** 1-based start, clamped to the text like BASIC MID$ and Pascal copy. */
	private static String substring(String s, int start, int length) {
		if (start < 1) {
			start = 1;
		}
		if (start > s.length()) {
			return "";
		}
		int end = (int) Math.min((long) start - 1 + length, s.length());
		return s.substring(start - 1, end);
	}
}
