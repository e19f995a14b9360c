package termui.runtime.vm;

import com.termui.compiler.codegen.CompiledChunk;
import com.termui.compiler.codegen.OpCode;
import termui.runtime.TermUiException;
import termui.runtime.UiBoolean;
import termui.runtime.UiNull;
import termui.runtime.UiNumber;
import termui.runtime.UiString;
import termui.runtime.UiValue;
import termui.runtime.intrinsic.IntrinsicRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 基于栈的字节码虚拟机
 *
 * <p>虚拟机本身不保存跨执行的状态：变量都在 {@link VMContext} 中，
 * 一个实例可以对同一上下文执行任意多个字节码块。同一时刻只允许一次执行，
 * 并发的第二次调用直接返回失败结果。</p>
 *
 * <p>停止用代数计数：{@link #stop()} 使代数加一，执行开始时记下的代数与当前代数
 * 不一致即中止。调用方可以先用 {@link #getStopGeneration()} 取得代数再执行，
 * 这样两者之间发出的停止请求也不会丢失。</p>
 *
 * <p>每条指令执行前检查：停止代数、迭代上限，以及每 {@code timeCheckInterval}
 * 次迭代检查一次耗时。任何故障都转换为失败的 {@link VMResult}，不会抛给调用方；
 * 故障前已经写入上下文的变量保持不变。</p>
 */
public class VirtualMachine {

    private static final Logger LOG = Logger.getLogger(VirtualMachine.class.getName());

    private final IntrinsicRegistry registry;
    private final ExecutionLimits limits;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong stopGeneration = new AtomicLong();

    public VirtualMachine(IntrinsicRegistry registry) {
        this(registry, ExecutionLimits.defaults());
    }

    public VirtualMachine(IntrinsicRegistry registry, ExecutionLimits limits) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
        this.limits = limits != null ? limits : ExecutionLimits.defaults();
    }

    public IntrinsicRegistry getRegistry() {
        return registry;
    }

    public ExecutionLimits getLimits() {
        return limits;
    }

    public boolean isRunning() {
        return running.get();
    }

    /** 当前停止代数 */
    public long getStopGeneration() {
        return stopGeneration.get();
    }

    /**
     * 请求停止当前执行，以及所有以更早代数开始的执行。循环在下一条指令前中止，
     * 正在执行的宿主调用会先完成。之后以新代数开始的执行不受影响。
     */
    public void stop() {
        stopGeneration.incrementAndGet();
    }

    /**
     * 以当前代数执行字节码块
     *
     * @param chunk   编译结果
     * @param context 持久上下文
     * @return 执行结果，从不抛出脚本故障
     */
    public VMResult execute(CompiledChunk chunk, VMContext context) {
        return execute(chunk, context, stopGeneration.get());
    }

    /**
     * 以给定代数执行字节码块；代数已过期时立即以停止失败返回
     */
    public VMResult execute(CompiledChunk chunk, VMContext context, long generation) {
        if (!running.compareAndSet(false, true)) {
            return VMResult.failure("VM is busy", 0);
        }
        Execution execution = null;
        try {
            execution = new Execution(chunk, context, generation);
            UiValue value = execution.run();
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("执行完成: " + chunk.getSourceName() + ", " + execution.iterations + " 条指令");
            }
            return VMResult.success(value, execution.iterations);
        } catch (TermUiException e) {
            LOG.fine("执行中止: " + e.getMessage());
            return VMResult.failure(e.getMessage(), iterationsOf(execution));
        } catch (RuntimeException e) {
            // 宿主函数或虚拟机自身的意外异常
            LOG.log(Level.WARNING, "脚本执行出错: " + chunk.getSourceName(), e);
            return VMResult.failure("Runtime error: " + describe(e), iterationsOf(execution));
        } catch (StackOverflowError | AssertionError | LinkageError e) {
            // 宿主函数抛出的错误同样只让本次执行失败
            LOG.log(Level.SEVERE, "宿主调用抛出错误: " + chunk.getSourceName(), e);
            return VMResult.failure("Runtime error: " + describe(e), iterationsOf(execution));
        } finally {
            running.set(false);
        }
    }

    private static long iterationsOf(Execution execution) {
        return execution != null ? execution.iterations : 0;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * 单次执行的状态：操作数栈、指令指针和计数器
     */
    private final class Execution {
        private final byte[] code;
        private final UiValue[] constants;
        private final List<String> names;
        private final VMContext context;

        private final UiValue[] stack;
        private int sp = 0;
        private int pc = 0;
        private long iterations = 0;
        private final long startNanos;
        private final long generation;

        Execution(CompiledChunk chunk, VMContext context, long generation) {
            this.generation = generation;
            this.code = chunk.getCode();
            this.names = chunk.getNames();
            this.context = context;
            this.stack = new UiValue[limits.getMaxStackSize()];
            this.constants = new UiValue[chunk.getConstants().size()];
            for (int i = 0; i < constants.length; i++) {
                constants[i] = UiValue.fromJava(chunk.getConstant(i));
            }
            this.startNanos = System.nanoTime();
        }

        UiValue run() {
            final long maxIterations = limits.getMaxIterations();
            final int timeCheckInterval = limits.getTimeCheckInterval();

            while (pc < code.length) {
                if (stopGeneration.get() != generation) {
                    throw new VMException("Execution stopped");
                }
                if (++iterations > maxIterations) {
                    throw new VMException("Execution limit exceeded (possible infinite loop)");
                }
                if (iterations % timeCheckInterval == 0) {
                    checkTime();
                }

                int opPc = pc;
                OpCode op = OpCode.fromByte(code[pc++] & 0xFF);
                if (op == null) {
                    throw new VMException("Unknown opcode " + (code[opPc] & 0xFF) + " at " + opPc);
                }

                switch (op) {
                    // ============ 栈操作 ============
                    case PUSH_CONST:
                        push(constants[readU16()]);
                        break;
                    case PUSH_NULL:
                        push(UiNull.NULL);
                        break;
                    case PUSH_TRUE:
                        push(UiBoolean.TRUE);
                        break;
                    case PUSH_FALSE:
                        push(UiBoolean.FALSE);
                        break;
                    case POP:
                        pop();
                        break;

                    // ============ 变量 ============
                    case LOAD_VAR: {
                        String name = names.get(readU16());
                        UiValue value = context.getVariable(name);
                        // 未绑定的名字压入名字本身，可直接作为被调用者
                        push(value != null ? value : UiString.of(name));
                        break;
                    }
                    case STORE_VAR:
                        context.setVariable(names.get(readU16()), peek());
                        break;

                    // ============ 算术 ============
                    case ADD: {
                        UiValue b = pop();
                        UiValue a = pop();
                        if (a.isString() || b.isString()) {
                            UiValue result = UiString.of(a.asString() + b.asString());
                            context.checkString(result);
                            push(result);
                        } else {
                            push(UiNumber.of(a.asDouble() + b.asDouble()));
                        }
                        break;
                    }
                    case SUB: {
                        double b = pop().asDouble();
                        push(UiNumber.of(pop().asDouble() - b));
                        break;
                    }
                    case MUL: {
                        double b = pop().asDouble();
                        push(UiNumber.of(pop().asDouble() * b));
                        break;
                    }
                    case DIV: {
                        double b = pop().asDouble();
                        double a = pop().asDouble();
                        if (b == 0) {
                            throw new VMException("Division by zero");
                        }
                        push(UiNumber.of(a / b));
                        break;
                    }
                    case MOD: {
                        double b = pop().asDouble();
                        double a = pop().asDouble();
                        if (b == 0) {
                            throw new VMException("Modulo by zero");
                        }
                        push(UiNumber.of(a % b));
                        break;
                    }
                    case NEG:
                        push(UiNumber.of(-pop().asDouble()));
                        break;

                    // ============ 比较 ============
                    case EQ: {
                        UiValue b = pop();
                        push(UiBoolean.of(pop().equals(b)));
                        break;
                    }
                    case NE: {
                        UiValue b = pop();
                        push(UiBoolean.of(!pop().equals(b)));
                        break;
                    }
                    case LT: {
                        double b = pop().asDouble();
                        push(UiBoolean.of(pop().asDouble() < b));
                        break;
                    }
                    case GT: {
                        double b = pop().asDouble();
                        push(UiBoolean.of(pop().asDouble() > b));
                        break;
                    }
                    case LE: {
                        double b = pop().asDouble();
                        push(UiBoolean.of(pop().asDouble() <= b));
                        break;
                    }
                    case GE: {
                        double b = pop().asDouble();
                        push(UiBoolean.of(pop().asDouble() >= b));
                        break;
                    }
                    case NOT:
                        push(UiBoolean.of(!pop().isTruthy()));
                        break;

                    // ============ 跳转 ============
                    case JUMP: {
                        int offset = readS16();
                        pc += offset;
                        break;
                    }
                    case JUMP_IF_FALSE: {
                        int offset = readS16();
                        if (!peek().isTruthy()) {
                            pc += offset;
                        }
                        break;
                    }
                    case JUMP_IF_TRUE: {
                        int offset = readS16();
                        if (peek().isTruthy()) {
                            pc += offset;
                        }
                        break;
                    }

                    // ============ 调用与成员 ============
                    case CALL: {
                        List<UiValue> args = popArgs(readU8());
                        UiValue callee = pop();
                        if (!(callee instanceof UiString)) {
                            throw new VMException("Cannot call non-function: " + callee.getTypeName());
                        }
                        push(hostResult(registry.callFunction(((UiString) callee).getValue(), args, context)));
                        break;
                    }
                    case CALL_METHOD: {
                        String name = names.get(readU16());
                        List<UiValue> args = popArgs(readU8());
                        UiValue target = pop();
                        push(hostResult(registry.callMethod(target, name, args, context)));
                        break;
                    }
                    case GET_MEMBER: {
                        String name = names.get(readU16());
                        push(hostResult(registry.getMember(pop(), name, context)));
                        break;
                    }
                    case SET_MEMBER: {
                        String name = names.get(readU16());
                        UiValue value = pop();
                        UiValue target = pop();
                        registry.setMember(target, name, value, context);
                        push(value);
                        break;
                    }

                    // ============ 结束 ============
                    case RETURN:
                        return null;
                    case RETURN_VALUE:
                        return pop();
                    case HALT:
                        return sp > 0 ? peek() : null;
                    default:
                        throw new VMException("Unhandled opcode " + op);
                }
            }
            return sp > 0 ? peek() : null;
        }

        private void checkTime() {
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
            if (elapsedMs > limits.getMaxExecutionTimeMs()) {
                throw new VMException("Execution time limit exceeded (" + limits.getMaxExecutionTimeMs() + "ms)");
            }
        }

        // ============ 栈 ============

        private void push(UiValue value) {
            if (sp >= stack.length) {
                throw new VMException("Stack overflow");
            }
            stack[sp++] = value;
        }

        private UiValue pop() {
            if (sp == 0) {
                throw new VMException("Stack underflow");
            }
            UiValue value = stack[--sp];
            stack[sp] = null;
            return value;
        }

        private UiValue peek() {
            if (sp == 0) {
                throw new VMException("Stack underflow");
            }
            return stack[sp - 1];
        }

        private List<UiValue> popArgs(int count) {
            if (count == 0) {
                return Collections.emptyList();
            }
            if (count > sp) {
                throw new VMException("Stack underflow");
            }
            UiValue[] args = Arrays.copyOfRange(stack, sp - count, sp);
            Arrays.fill(stack, sp - count, sp, null);
            sp -= count;
            return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args)));
        }

        private UiValue hostResult(UiValue value) {
            context.checkString(value);
            return value;
        }

        // ============ 操作数 ============

        private int readU8() {
            if (pc >= code.length) {
                throw new VMException("Truncated operand at " + pc);
            }
            return code[pc++] & 0xFF;
        }

        private int readU16() {
            if (pc + 1 >= code.length) {
                throw new VMException("Truncated operand at " + pc);
            }
            int value = ((code[pc] & 0xFF) << 8) | (code[pc + 1] & 0xFF);
            pc += 2;
            return value;
        }

        private int readS16() {
            return (short) readU16();
        }
    }
}
