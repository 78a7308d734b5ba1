package io.github.manjago.netscript.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Compiles a legacy script syntax tree into flat instruction lists.
 * <p>
 * Every function (and the program itself) becomes one {@link FunctionCode}.
 * Function declarations that sit directly in a body are hoisted: they are
 * declared before the first statement of that body runs.
 */
public class Compiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    /**
     * Compile a parsed program.
     *
     * @param program syntax tree with all imports already resolved
     * @return code of the program entry point
     * @throws ScriptSyntaxException if the tree still contains import declarations
     */
    public FunctionCode compile(Program program) throws ScriptSyntaxException {
        FunctionCode main = new Emitter(FunctionCode.MAIN, List.of()).compileBody(program.body(), true);
        log.debug("Compiled program: {} instructions", main.size());
        return main;
    }

    /**
     * Parse and compile source text.
     */
    public FunctionCode compile(String source) throws ScriptSyntaxException {
        return compile(Parser.parse(source));
    }

    /**
     * Per-function code emitter.
     */
    private static final class Emitter {

        private final String name;
        private final List<String> params;
        private final List<Instruction> code = new ArrayList<>();
        private final Deque<Loop> loops = new ArrayDeque<>();

        Emitter(String name, List<String> params) {
            this.name = name;
            this.params = params;
        }

        FunctionCode compileBody(List<Stmt> body, boolean isMain) throws ScriptSyntaxException {
            // Hoist function declarations
            for (Stmt stmt : body) {
                if (stmt instanceof Stmt.Function fn) {
                    emit(OpCode.FUNC_DECL, compileFunction(fn.name(), fn.params(), fn.body()), fn.line());
                }
            }
            for (Stmt stmt : body) {
                if (!(stmt instanceof Stmt.Function)) {
                    statement(stmt);
                }
            }
            int lastLine = code.isEmpty() ? 1 : code.get(code.size() - 1).line();
            if (isMain) {
                emit(OpCode.HALT, null, lastLine);
            } else {
                emit(OpCode.CONST, null, lastLine);
                emit(OpCode.RETURN, null, lastLine);
            }
            return new FunctionCode(name, params, List.copyOf(code));
        }

        private static FunctionCode compileFunction(String name, List<String> params, List<Stmt> body)
                throws ScriptSyntaxException {
            return new Emitter(name != null ? name : "<anonymous>", params).compileBody(body, false);
        }

        // ========== Statements ==========

        private void statement(Stmt stmt) throws ScriptSyntaxException {
            if (stmt instanceof Stmt.Expression s) {
                expression(s.expression());
                emit(OpCode.POP, null, s.line());
            } else if (stmt instanceof Stmt.Var s) {
                if (s.initializer() != null) {
                    expression(s.initializer());
                    emit(OpCode.DECLARE, s.name(), s.line());
                } else {
                    emit(OpCode.DECLARE_EMPTY, s.name(), s.line());
                }
            } else if (stmt instanceof Stmt.Block s) {
                for (Stmt inner : s.statements()) {
                    statement(inner);
                }
            } else if (stmt instanceof Stmt.If s) {
                ifStatement(s);
            } else if (stmt instanceof Stmt.While s) {
                whileStatement(s);
            } else if (stmt instanceof Stmt.For s) {
                forStatement(s);
            } else if (stmt instanceof Stmt.Break s) {
                currentLoop(s.line()).breaks.add(emit(OpCode.JUMP, -1, s.line()));
            } else if (stmt instanceof Stmt.Continue s) {
                currentLoop(s.line()).continues.add(emit(OpCode.JUMP, -1, s.line()));
            } else if (stmt instanceof Stmt.Return s) {
                if (s.value() != null) {
                    expression(s.value());
                } else {
                    emit(OpCode.CONST, null, s.line());
                }
                emit(OpCode.RETURN, null, s.line());
            } else if (stmt instanceof Stmt.Function s) {
                emit(OpCode.FUNC_DECL, compileFunction(s.name(), s.params(), s.body()), s.line());
            } else if (stmt instanceof Stmt.Import s) {
                throw new ScriptSyntaxException("Unresolved import of '" + s.source() + "'", s.line());
            } else {
                throw new ScriptSyntaxException("Unsupported statement " + stmt.getClass().getSimpleName(), stmt.line());
            }
        }

        private void ifStatement(Stmt.If s) throws ScriptSyntaxException {
            expression(s.condition());
            int toElse = emit(OpCode.JUMP_IF_FALSE, -1, s.line());
            statement(s.thenBranch());
            if (s.elseBranch() != null) {
                int toEnd = emit(OpCode.JUMP, -1, s.line());
                patch(toElse, here());
                statement(s.elseBranch());
                patch(toEnd, here());
            } else {
                patch(toElse, here());
            }
        }

        private void whileStatement(Stmt.While s) throws ScriptSyntaxException {
            int start = here();
            expression(s.condition());
            int exit = emit(OpCode.JUMP_IF_FALSE, -1, s.line());
            Loop loop = new Loop();
            loops.push(loop);
            statement(s.body());
            loops.pop();
            emit(OpCode.JUMP, start, s.line());
            patch(exit, here());
            loop.close(this, start, here());
        }

        private void forStatement(Stmt.For s) throws ScriptSyntaxException {
            if (s.init() != null) {
                statement(s.init());
            }
            int start = here();
            int exit = -1;
            if (s.condition() != null) {
                expression(s.condition());
                exit = emit(OpCode.JUMP_IF_FALSE, -1, s.line());
            }
            Loop loop = new Loop();
            loops.push(loop);
            statement(s.body());
            loops.pop();
            int continueTarget = here();
            if (s.update() != null) {
                expression(s.update());
                emit(OpCode.POP, null, s.line());
            }
            emit(OpCode.JUMP, start, s.line());
            if (exit >= 0) {
                patch(exit, here());
            }
            loop.close(this, continueTarget, here());
        }

        private Loop currentLoop(int line) throws ScriptSyntaxException {
            Loop loop = loops.peek();
            if (loop == null) {
                throw new ScriptSyntaxException("Jump statement outside of a loop", line);
            }
            return loop;
        }

        // ========== Expressions ==========

        private void expression(Expr expr) throws ScriptSyntaxException {
            if (expr instanceof Expr.Literal e) {
                emit(OpCode.CONST, e.value(), e.line());
            } else if (expr instanceof Expr.Variable e) {
                emit(OpCode.LOAD, e.name(), e.line());
            } else if (expr instanceof Expr.Assign e) {
                assign(e);
            } else if (expr instanceof Expr.Update e) {
                update(e);
            } else if (expr instanceof Expr.Logical e) {
                expression(e.left());
                OpCode jump = "&&".equals(e.op()) ? OpCode.JUMP_IF_FALSE_OR_POP : OpCode.JUMP_IF_TRUE_OR_POP;
                int end = emit(jump, -1, e.line());
                expression(e.right());
                patch(end, here());
            } else if (expr instanceof Expr.Binary e) {
                expression(e.left());
                expression(e.right());
                emit(OpCode.BINARY, e.op(), e.line());
            } else if (expr instanceof Expr.Unary e) {
                expression(e.operand());
                emit(OpCode.UNARY, e.op(), e.line());
            } else if (expr instanceof Expr.Call e) {
                expression(e.callee());
                for (Expr arg : e.arguments()) {
                    expression(arg);
                }
                emit(OpCode.CALL, e.arguments().size(), e.line());
            } else if (expr instanceof Expr.Member e) {
                expression(e.object());
                emit(OpCode.GET_MEMBER, e.name(), e.line());
            } else if (expr instanceof Expr.Index e) {
                expression(e.object());
                expression(e.index());
                emit(OpCode.GET_INDEX, null, e.line());
            } else if (expr instanceof Expr.ArrayLiteral e) {
                for (Expr element : e.elements()) {
                    expression(element);
                }
                emit(OpCode.ARRAY, e.elements().size(), e.line());
            } else if (expr instanceof Expr.ObjectLiteral e) {
                for (Expr value : e.values()) {
                    expression(value);
                }
                emit(OpCode.OBJECT, e.keys(), e.line());
            } else if (expr instanceof Expr.Function e) {
                emit(OpCode.CLOSURE, compileFunction(e.name(), e.params(), e.body()), e.line());
            } else {
                throw new ScriptSyntaxException("Unsupported expression " + expr.getClass().getSimpleName(), expr.line());
            }
        }

        private void assign(Expr.Assign e) throws ScriptSyntaxException {
            String op = e.op().equals("=") ? null : e.op().substring(0, 1);
            int line = e.line();

            if (e.target() instanceof Expr.Variable v) {
                if (op != null) {
                    emit(OpCode.LOAD, v.name(), line);
                    expression(e.value());
                    emit(OpCode.BINARY, op, line);
                } else {
                    expression(e.value());
                }
                emit(OpCode.STORE, v.name(), line);
            } else if (e.target() instanceof Expr.Member m) {
                expression(m.object());
                if (op != null) {
                    emit(OpCode.DUP, null, line);
                    emit(OpCode.GET_MEMBER, m.name(), line);
                    expression(e.value());
                    emit(OpCode.BINARY, op, line);
                } else {
                    expression(e.value());
                }
                emit(OpCode.SET_MEMBER, m.name(), line);
            } else if (e.target() instanceof Expr.Index ix) {
                expression(ix.object());
                expression(ix.index());
                if (op != null) {
                    emit(OpCode.DUP2, null, line);
                    emit(OpCode.GET_INDEX, null, line);
                    expression(e.value());
                    emit(OpCode.BINARY, op, line);
                } else {
                    expression(e.value());
                }
                emit(OpCode.SET_INDEX, null, line);
            } else {
                throw new ScriptSyntaxException("Invalid assignment target", line);
            }
        }

        private void update(Expr.Update e) throws ScriptSyntaxException {
            String op = e.increment() ? "+" : "-";
            assign(new Expr.Assign(e.target(), op + "=", new Expr.Literal(1.0, e.line()), e.line()));
            if (!e.prefix()) {
                // Postfix yields the value before the update
                emit(OpCode.CONST, 1.0, e.line());
                emit(OpCode.BINARY, e.increment() ? "-" : "+", e.line());
            }
        }

        // ========== Emission ==========

        private int emit(OpCode op, Object operand, int line) {
            code.add(new Instruction(op, operand, line));
            return code.size() - 1;
        }

        private int here() {
            return code.size();
        }

        private void patch(int index, int target) {
            code.set(index, code.get(index).withOperand(target));
        }
    }

    /**
     * Pending break/continue jumps of one loop.
     */
    private static final class Loop {
        final List<Integer> breaks = new ArrayList<>();
        final List<Integer> continues = new ArrayList<>();

        void close(Emitter emitter, int continueTarget, int breakTarget) {
            for (int index : breaks) {
                emitter.patch(index, breakTarget);
            }
            for (int index : continues) {
                emitter.patch(index, continueTarget);
            }
        }
    }
}
