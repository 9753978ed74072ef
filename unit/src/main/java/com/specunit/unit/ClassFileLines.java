package com.specunit.unit;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Where the methods of a class start, read from the line number table of its class file.
 */
final class ClassFileLines {
    private static final Logger logger = LoggerFactory.getLogger(ClassFileLines.class);

    private final String className;
    private final String sourceFile;
    private final Map<String, Integer> firstLines;

    private ClassFileLines(String className, String sourceFile, Map<String, Integer> firstLines) {
        this.className = className;
        this.sourceFile = sourceFile;
        this.firstLines = firstLines;
    }

    static ClassFileLines read(Class<?> type) {
        String resource = "/" + type.getName().replace('.', '/') + ".class";
        try (InputStream in = type.getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("No class file for {}, imported methods keep the import location", type.getName());
                return empty(type);
            }
            LineCollector collector = new LineCollector();
            new ClassReader(in).accept(collector, ClassReader.SKIP_FRAMES);
            return new ClassFileLines(type.getName(), collector.sourceFile, collector.firstLines);
        } catch (IOException e) {
            logger.warn("Could not read line numbers of {}", type.getName(), e);
            return empty(type);
        }
    }

    private static ClassFileLines empty(Class<?> type) {
        return new ClassFileLines(type.getName(), null, Collections.emptyMap());
    }

    /**
     * A frame pointing at the first line of {@code method}; empty when the class was compiled without debug info.
     */
    Optional<StackTraceElement> definitionOf(Method method) {
        Integer line = firstLines.get(method.getName() + Type.getMethodDescriptor(method));
        if (line == null || sourceFile == null) {
            return Optional.empty();
        }
        return Optional.of(new StackTraceElement(className, method.getName(), sourceFile, line));
    }

    private static class LineCollector extends ClassVisitor {
        private final Map<String, Integer> firstLines = new HashMap<>();
        private String sourceFile;

        LineCollector() {
            super(Opcodes.ASM9);
        }

        @Override
        public void visitSource(String source, String debug) {
            this.sourceFile = source;
        }

        @Override
        public MethodVisitor visitMethod(int access, String name, String descriptor, String signature,
                                         String[] exceptions) {
            String key = name + descriptor;
            return new MethodVisitor(Opcodes.ASM9) {
                @Override
                public void visitLineNumber(int line, Label start) {
                    firstLines.merge(key, line, Math::min);
                }
            };
        }
    }
}
