package com.termui.compiler.codegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 编译后的字节码块：指令流 + 去重常量池 + 去重名字池，构造后不可变。
 *
 * <p>常量池元素为 {@link Double} 或 {@link String}。</p>
 */
public final class CompiledChunk {
    private final String sourceName;
    private final byte[] code;
    private final List<Object> constants;
    private final List<String> names;

    public CompiledChunk(String sourceName, byte[] code, List<Object> constants, List<String> names) {
        this.sourceName = sourceName;
        this.code = code.clone();
        this.constants = Collections.unmodifiableList(constants);
        this.names = Collections.unmodifiableList(names);
    }

    private CompiledChunk(String sourceName, CompiledChunk other) {
        this.sourceName = sourceName;
        this.code = other.code;
        this.constants = other.constants;
        this.names = other.names;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * 同一字节码换一个来源名，指令流和常量池共享
     */
    public CompiledChunk withSourceName(String name) {
        if (name == null ? sourceName == null : name.equals(sourceName)) {
            return this;
        }
        return new CompiledChunk(name, this);
    }

    /** 指令流副本 */
    public byte[] getCode() {
        return code.clone();
    }

    public int getCodeLength() {
        return code.length;
    }

    /** 读取无符号字节 */
    public int readU8(int offset) {
        return code[offset] & 0xFF;
    }

    /** 读取无符号 16 位（大端） */
    public int readU16(int offset) {
        return ((code[offset] & 0xFF) << 8) | (code[offset + 1] & 0xFF);
    }

    /** 读取有符号 16 位（大端） */
    public int readS16(int offset) {
        return (short) readU16(offset);
    }

    public List<Object> getConstants() {
        return constants;
    }

    public Object getConstant(int index) {
        return constants.get(index);
    }

    public List<String> getNames() {
        return names;
    }

    public String getName(int index) {
        return names.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledChunk)) return false;
        CompiledChunk other = (CompiledChunk) o;
        return Arrays.equals(code, other.code)
                && constants.equals(other.constants)
                && names.equals(other.names);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(code);
        result = 31 * result + constants.hashCode();
        result = 31 * result + names.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "CompiledChunk{" + sourceName + ", " + code.length + " bytes, "
                + constants.size() + " constants, " + names.size() + " names}";
    }
}
