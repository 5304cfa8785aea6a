package org.metricshub.jcae.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jcae
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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import org.metricshub.jcae.intermediate.CaeProgram;
import org.metricshub.jcae.intermediate.Instruction;
import org.metricshub.jcae.intermediate.Procedure;
import org.metricshub.jcae.intermediate.RegionReference;
import org.metricshub.jcae.jrt.CallDepthExceededException;
import org.metricshub.jcae.jrt.EndOfInputException;
import org.metricshub.jcae.jrt.Region;
import org.metricshub.jcae.jrt.RegionStore;
import org.metricshub.jcae.util.CaeLogger;
import org.metricshub.jcae.util.CaeSettings;
import org.metricshub.jcae.util.EndOfInputPolicy;
import org.slf4j.Logger;

/**
 * The Cae virtual machine.
 * <p>
 * It takes a validated {@link CaeProgram} and executes its instructions
 * against freshly allocated regions, one instruction at a time, on an
 * explicit {@link CallStack}. Each frame binds two regions:
 * <ul>
 * <li><code>here</code>, which every instruction without an explicit
 * target acts on;
 * <li><code>origin</code>, which the back-reference <code>$</code>
 * resolves to.
 * </ul>
 * A call computes the bindings of the new frame from the caller's frame
 * and the call clause only:
 * <ul>
 * <li>no clause: <code>(here, origin)</code> are kept;
 * <li><code>@R</code>: <code>(R, caller's here)</code>;
 * <li><code>@$</code>: <code>(caller's origin, caller's origin)</code>.
 * </ul>
 * Loop bodies run in the frame of their procedure. The run starts with a
 * frame for <code>main</code> bound to region <code>main</code> twice, and
 * ends when that frame returns.
 * <p>
 * Semantic analysis has occurred prior to execution, so every name lookup
 * succeeds and every arithmetic operation wraps. The only failures are
 * I/O errors of the streams and the environmental limits reported as
 * {@link org.metricshub.jcae.jrt.CaeRuntimeException}s.
 */
public class CVM implements CaeInterpreter {

	private static final Logger LOG = CaeLogger.getLogger(CVM.class);

	private final InputStream input;
	private final OutputStream output;
	private final EndOfInputPolicy endOfInputPolicy;
	private final int maxCallDepth;

	private final CallStack callStack = new CallStack();
	private CaeProgram program;
	private RegionStore regions;
	private long executedInstructions;

	/**
	 * @param settings streams and limits of the run
	 */
	public CVM(CaeSettings settings) {
		this.input = settings.getInput();
		this.output = settings.getOutputStream();
		this.endOfInputPolicy = settings.getEndOfInputPolicy();
		this.maxCallDepth = settings.getMaxCallDepth();
	}

	/** {@inheritDoc} */
	@Override
	public void interpret(CaeProgram caeProgram) throws IOException {
		this.program = caeProgram;
		this.regions = new RegionStore(caeProgram);
		this.executedInstructions = 0;

		Region main = regions.get(CaeProgram.MAIN);
		callStack.clear();
		callStack.push(new Frame(caeProgram.getMainProcedure(), main, main));
		LOG.debug("Starting run with {} region(s)", caeProgram.getRegionCapacities().size());

		try {
			while (!callStack.isEmpty()) {
				Frame frame = callStack.peek();
				Instruction instruction = frame.current();
				if (instruction == null) {
					if (frame.inLoop()) {
						frame.exitLoop();
					} else {
						callStack.pop();
					}
					continue;
				}
				executedInstructions++;
				Region here = frame.getHere();
				switch (instruction.getOpcode()) {
				case INCREMENT:
					here.increment();
					frame.advance();
					break;
				case DECREMENT:
					here.decrement();
					frame.advance();
					break;
				case MOVE_RIGHT:
					here.moveRight();
					frame.advance();
					break;
				case MOVE_LEFT:
					here.moveLeft();
					frame.advance();
					break;
				case RESET_HEAD:
					here.resetHead();
					frame.advance();
					break;
				case WRITE_LITERAL:
					here.set(instruction.getLiteral());
					frame.advance();
					break;
				case OUTPUT:
					output.write(here.get());
					frame.advance();
					break;
				case INPUT:
					readInto(here, instruction);
					frame.advance();
					break;
				case LOOP:
					// test before each iteration; the cursor stays on the LOOP while its body runs
					if (here.get() == 0) {
						frame.advance();
					} else {
						frame.enterLoop(instruction.getBody());
					}
					break;
				case SEND:
					resolve(instruction.getRegion(), frame).set(here.get());
					frame.advance();
					break;
				case RECEIVE:
					here.set(resolve(instruction.getRegion(), frame).get());
					frame.advance();
					break;
				case CALL:
					frame.advance();
					call(frame, instruction);
					break;
				default:
					throw new Error("Unknown opcode: " + instruction.getOpcode());
				}
			}
		} finally {
			callStack.clear();
			output.flush();
		}
		LOG.debug("Run finished after {} instruction(s)", executedInstructions);
	}

	private void call(Frame caller, Instruction instruction) {
		Procedure callee = instruction.isAnonymousCall()
				? instruction.getAnonymousProcedure()
				: program.getProcedure(instruction.getProcedureName());
		RegionReference clause = instruction.getRegion();

		Region here;
		Region origin;
		if (clause == null) {
			here = caller.getHere();
			origin = caller.getOrigin();
		} else if (clause.isBackReference()) {
			here = caller.getOrigin();
			origin = caller.getOrigin();
		} else {
			here = regions.get(clause.getName());
			origin = caller.getHere();
		}

		if (maxCallDepth > 0 && callStack.depth() >= maxCallDepth) {
			throw new CallDepthExceededException(instruction.getLineNumber(), callee.getLabel(), maxCallDepth);
		}
		if (LOG.isTraceEnabled()) {
			LOG
					.trace(
							"Call {} here={} origin={} depth={}",
							callee.getLabel(),
							here.getName(),
							origin.getName(),
							callStack.depth() + 1);
		}
		callStack.push(new Frame(callee, here, origin));
	}

	private Region resolve(RegionReference reference, Frame frame) {
		return reference.isBackReference() ? frame.getOrigin() : regions.get(reference.getName());
	}

	private void readInto(Region here, Instruction instruction) throws IOException {
		int b = input.read();
		if (b >= 0) {
			here.set(b);
			return;
		}
		switch (endOfInputPolicy) {
		case ZERO:
			here.set(0);
			break;
		case UNCHANGED:
			break;
		case ERROR:
			throw new EndOfInputException(instruction.getLineNumber(), here.getName());
		default:
			throw new Error("Unknown end-of-input policy: " + endOfInputPolicy);
		}
	}

	/**
	 * @return the memory of the last run, <code>null</code> before any run
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public RegionStore getRegions() {
		return regions;
	}

	/**
	 * @return number of instructions executed by the last run
	 */
	public long getExecutedInstructions() {
		return executedInstructions;
	}
}
