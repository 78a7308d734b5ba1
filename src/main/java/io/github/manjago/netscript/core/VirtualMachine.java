package io.github.manjago.netscript.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Stepping interpreter for compiled legacy scripts.
 * <p>
 * {@link #step(VmState)} executes exactly one instruction. A call to an
 * asynchronous {@link NativeFunction} suspends the program on the returned
 * future; the step after it settles pushes the result (or raises the failure
 * as a guest fault) instead of executing an instruction.
 */
public final class VirtualMachine {

    private static final Logger log = LoggerFactory.getLogger(VirtualMachine.class);

    /** Default limit of nested guest calls */
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final int maxDepth;

    public VirtualMachine() {
        this(DEFAULT_MAX_DEPTH);
    }

    public VirtualMachine(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Prepare a program for stepping.
     *
     * @param main    compiled program entry point
     * @param globals global scope, already holding host functions and {@code args}
     */
    public VmState load(FunctionCode main, Scope globals) {
        return new VmState(main, globals);
    }

    /**
     * Advance the program by one unit of work.
     *
     * @param state program state
     * @return true if more work remains
     * @throws ScriptRuntimeException on a guest fault; the line is the executed line
     */
    public boolean step(VmState state) {
        switch (state.getStatus()) {
            case DONE -> {
                return false;
            }
            case SUSPENDED -> {
                return resume(state);
            }
            default -> state.setStatus(VmStatus.RUNNING);
        }

        Frame frame = state.currentFrame();
        if (frame.ip >= frame.code.size()) {
            state.finish(null);
            return false;
        }
        Instruction instruction = frame.code.at(frame.ip++);
        state.incrementSteps();
        try {
            execute(instruction, frame, state);
        } catch (ScriptRuntimeException e) {
            throw e.atLine(instruction.line());
        } catch (ClassCastException | IndexOutOfBoundsException e) {
            throw new ScriptRuntimeException("Internal error at " + instruction.op().getMnemonic()
                    + ": " + e.getMessage(), instruction.line());
        }
        return !state.isDone();
    }

    // ========== Suspension ==========

    private boolean resume(VmState state) {
        CompletableFuture<Object> pending = state.getPending();
        if (!pending.isDone()) {
            return true;
        }
        int line = state.currentLine();
        String name = state.getPendingName();
        state.takePending();
        Object value;
        try {
            value = pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScriptRuntimeException(name + ": interrupted", line);
        } catch (CancellationException e) {
            throw new ScriptRuntimeException(name + " was cancelled", line);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ScriptRuntimeException sre) {
                throw sre.atLine(line);
            }
            if (cause instanceof RuntimeException re && !(re instanceof CompletionException)) {
                // Stop signals and other host exceptions travel unchanged
                throw re;
            }
            throw new ScriptRuntimeException(String.valueOf(cause.getMessage()), line);
        }
        state.currentFrame().push(GuestValues.toGuest(value));
        log.trace("Resumed after {} with {}", name, value);
        return true;
    }

    // ========== Instructions ==========

    private void execute(Instruction in, Frame frame, VmState state) {
        switch (in.op()) {
            case CONST -> frame.push(in.operand());
            case POP -> frame.pop();
            case DUP -> frame.push(frame.peek());
            case DUP2 -> {
                Object a = frame.peek(1);
                Object b = frame.peek();
                frame.push(a);
                frame.push(b);
            }
            case LOAD -> frame.push(frame.scope.get(in.name()));
            case STORE -> frame.scope.assign(in.name(), frame.peek());
            case DECLARE -> frame.scope.define(in.name(), frame.pop());
            case DECLARE_EMPTY -> {
                if (!frame.scope.hasOwn(in.name())) {
                    frame.scope.define(in.name(), null);
                }
            }
            case GET_MEMBER -> frame.push(GuestValues.getMember(frame.pop(), in.name()));
            case SET_MEMBER -> {
                Object value = frame.pop();
                Object target = frame.pop();
                GuestValues.setMember(target, in.name(), value);
                frame.push(value);
            }
            case GET_INDEX -> {
                Object key = frame.pop();
                Object target = frame.pop();
                if (target == null) {
                    throw new ScriptRuntimeException("TypeError: Cannot read property '"
                            + GuestValues.toDisplayString(key) + "' of null");
                }
                frame.push(GuestValues.getIndex(target, key));
            }
            case SET_INDEX -> {
                Object value = frame.pop();
                Object key = frame.pop();
                Object target = frame.pop();
                GuestValues.setIndex(target, key, value);
                frame.push(value);
            }
            case BINARY -> {
                Object b = frame.pop();
                Object a = frame.pop();
                frame.push(GuestValues.binary(in.name(), a, b));
            }
            case UNARY -> frame.push(GuestValues.unary(in.name(), frame.pop()));
            case JUMP -> frame.ip = in.target();
            case JUMP_IF_FALSE -> {
                if (!GuestValues.isTruthy(frame.pop())) {
                    frame.ip = in.target();
                }
            }
            case JUMP_IF_FALSE_OR_POP -> {
                if (!GuestValues.isTruthy(frame.peek())) {
                    frame.ip = in.target();
                } else {
                    frame.pop();
                }
            }
            case JUMP_IF_TRUE_OR_POP -> {
                if (GuestValues.isTruthy(frame.peek())) {
                    frame.ip = in.target();
                } else {
                    frame.pop();
                }
            }
            case ARRAY -> frame.push(popArguments(frame, (Integer) in.operand()));
            case OBJECT -> {
                @SuppressWarnings("unchecked")
                List<String> keys = (List<String>) in.operand();
                List<Object> values = popArguments(frame, keys.size());
                Map<String, Object> object = new LinkedHashMap<>();
                for (int i = 0; i < keys.size(); i++) {
                    object.put(keys.get(i), values.get(i));
                }
                frame.push(object);
            }
            case CLOSURE -> frame.push(new Closure((FunctionCode) in.operand(), frame.scope));
            case FUNC_DECL -> {
                FunctionCode code = (FunctionCode) in.operand();
                frame.scope.define(code.name(), new Closure(code, frame.scope));
            }
            case CALL -> call(frame, state, (Integer) in.operand());
            case RETURN -> {
                Object value = frame.pop();
                state.popFrame();
                Frame caller = state.currentFrame();
                if (caller == null) {
                    state.finish(value);
                } else {
                    caller.push(value);
                }
            }
            case HALT -> state.finish(null);
        }
    }

    private void call(Frame frame, VmState state, int argc) {
        List<Object> args = popArguments(frame, argc);
        Object callee = frame.pop();

        if (callee instanceof Closure closure) {
            if (state.depth() >= maxDepth) {
                throw new ScriptRuntimeException("RangeError: Maximum call stack size exceeded");
            }
            Scope scope = new Scope(closure.scope());
            List<String> params = closure.code().params();
            for (int i = 0; i < params.size(); i++) {
                scope.define(params.get(i), i < args.size() ? args.get(i) : null);
            }
            state.pushFrame(new Frame(closure.code(), scope));
            return;
        }

        if (callee instanceof NativeFunction fn) {
            List<Object> nativeArgs = new ArrayList<>(args.size());
            for (Object arg : args) {
                nativeArgs.add(GuestValues.toNative(arg));
            }
            Object result = fn.call(Collections.unmodifiableList(nativeArgs));
            if (fn.isAsync()) {
                if (!(result instanceof CompletionStage<?> stage)) {
                    throw new ScriptRuntimeException(fn.name() + " did not return a pending result");
                }
                @SuppressWarnings("unchecked")
                CompletableFuture<Object> future = (CompletableFuture<Object>) (CompletableFuture<?>) stage.toCompletableFuture();
                state.suspend(fn.name(), future);
                log.trace("Suspended on {}", fn.name());
            } else {
                frame.push(GuestValues.toGuest(result));
            }
            return;
        }

        throw new ScriptRuntimeException("TypeError: " + GuestValues.toDisplayString(callee) + " is not a function");
    }

    private static List<Object> popArguments(Frame frame, int count) {
        List<Object> values = new ArrayList<>(Collections.nCopies(count, null));
        for (int i = count - 1; i >= 0; i--) {
            values.set(i, frame.pop());
        }
        return values;
    }
}
