package com.ryuqq.fixture.core.diagnostics;

import com.ryuqq.fixture.core.failure.StackTraceInfo;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 예외 메시지와 스택 트레이스 추출기.
 *
 * <p>Setup 실패와 teardown 실패 보고에 공통으로 사용됩니다.</p>
 *
 * <p><strong>포맷:</strong></p>
 * <pre>
 * describe():  java.lang.IllegalStateException: outer ---&gt; java.io.IOException: disk full
 * extract():      at com.example.Tests.init(Tests.java:42)
 *                 ...
 *              Caused by: java.io.IOException: disk full
 *                 at ...
 * </pre>
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public final class StackTraces {

    private static final String FRAME_PREFIX = "   at ";
    private static final String CAUSE_SEPARATOR = " ---> ";
    private static final StackTraceElement[] NO_FRAMES = new StackTraceElement[0];

    private final DiagnosticsConfig config;

    /**
     * 생성자.
     *
     * @param config 진단 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public StackTraces(DiagnosticsConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 예외 메시지 원문 (타입 이름 접두사 없음).
     *
     * <p>사용자 예외의 {@code getMessage()}가 예외를 던지면
     * {@code "(message unavailable: 타입)"}을 반환합니다.</p>
     *
     * @param error 예외
     * @return 메시지, 없으면 빈 문자열
     */
    public static String rawMessage(Throwable error) {
        try {
            String message = error.getMessage();
            return message == null ? "" : message;
        } catch (RuntimeException e) {
            return "(message unavailable: " + error.getClass().getName() + ")";
        }
    }

    /**
     * 예외의 원인 조회.
     *
     * @param error 예외
     * @return 원인, 없거나 {@code getCause()}가 예외를 던지면 null
     */
    public static Throwable causeOf(Throwable error) {
        try {
            return error.getCause();
        } catch (RuntimeException e) {
            return null;
        }
    }

    /**
     * 예외 타입과 메시지를 원인 체인까지 포함하여 기술.
     *
     * @param error 예외
     * @return "타입: 메시지 ---&gt; 원인타입: 원인메시지" 형식 문자열
     */
    public String describe(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && seen.add(current)) {
            if (sb.length() > 0) {
                sb.append(CAUSE_SEPARATOR);
            }
            sb.append(current.getClass().getName()).append(": ").append(rawMessage(current));
            current = causeOf(current);
        }
        return sb.toString();
    }

    /**
     * 스택 트레이스 추출.
     *
     * <p>제외 대상 프레임을 건너뛰고, 원인 체인 전체에 걸쳐 최대
     * {@link DiagnosticsConfig#maxStackFrames()}개의 프레임만 포함합니다.</p>
     *
     * @param error 예외
     * @return 스택 트레이스 정보, 남은 프레임이 하나도 없으면 null
     */
    public StackTraceInfo extract(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        StackTraceElement topFrame = null;
        int budget = config.maxStackFrames();
        int written = 0;

        Throwable current = error;
        while (current != null && seen.add(current) && budget > 0) {
            if (current != error) {
                appendLine(sb, "Caused by: " + current.getClass().getName() + ": " + rawMessage(current));
            }
            for (StackTraceElement frame : framesOf(current)) {
                if (budget == 0) {
                    break;
                }
                if (frame == null || config.isExcluded(frame.getClassName())) {
                    continue;
                }
                if (topFrame == null) {
                    topFrame = frame;
                }
                appendLine(sb, FRAME_PREFIX + frame);
                budget--;
                written++;
            }
            current = causeOf(current);
        }

        if (written == 0) {
            return null;
        }
        return new StackTraceInfo(sb.toString(), topFrame.getFileName(), topFrame.getLineNumber());
    }

    private static StackTraceElement[] framesOf(Throwable error) {
        try {
            StackTraceElement[] frames = error.getStackTrace();
            return frames == null ? NO_FRAMES : frames;
        } catch (RuntimeException e) {
            return NO_FRAMES;
        }
    }

    private static void appendLine(StringBuilder sb, String line) {
        if (sb.length() > 0) {
            sb.append(System.lineSeparator());
        }
        sb.append(line);
    }
}
