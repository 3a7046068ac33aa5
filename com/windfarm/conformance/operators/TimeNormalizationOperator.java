package com.windfarm.conformance.operators;

import com.windfarm.conformance.core.OperatorContext;
import com.windfarm.conformance.core.UFunction;
import com.windfarm.conformance.exception.MalformedTimestampException;
import com.windfarm.conformance.exception.PipelineConfigurationException;
import com.windfarm.conformance.model.FunctionMetadata;
import com.windfarm.conformance.model.Observation;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.ParameterDefinition;
import com.windfarm.conformance.model.ParameterDefinition.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 时间归一化算子。
 * 将原始时间戳文本解析为UTC下的无时区时间。
 *
 * 时间戳带偏移（Z、+01:00、+0100、+01）时按偏移换算；不带偏移时按数据源契约中
 * 声明的假定偏移（默认UTC）换算。日期与时间之间可用'T'或空格分隔，秒和小数秒可省略。
 *
 * 参数：
 * - assumedOffset: 覆盖契约中的假定偏移 (STRING, 可选，如 +01:00)
 */
public class TimeNormalizationOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(TimeNormalizationOperator.class);

    public static final String FUNCTION_ID = "time_normalization";

    private static final Pattern TIMESTAMP = Pattern.compile(
            "(\\d{4}-\\d{1,2}-\\d{1,2})"
                    + "(?:[T ](\\d{1,2}):(\\d{2})(?::(\\d{2})(?:[.,](\\d{1,9}))?)?)?"
                    + "\\s*(Z|UTC|[+-]\\d{2}(?::?\\d{2})?)?",
            Pattern.CASE_INSENSITIVE);

    private ZoneOffset assumedOffset;

    @Override
    public void initialize(OperatorContext context) {
        String override = context.getParameter("assumedOffset", "");
        if (override.isBlank()) {
            this.assumedOffset = context.getSourceSchema().getAssumedOffset();
        } else {
            try {
                this.assumedOffset = ZoneOffset.of(override.trim());
            } catch (DateTimeException e) {
                throw new PipelineConfigurationException(context.getSourceSchema().getName(),
                        List.of("Invalid assumedOffset '" + override + "': " + e.getMessage()));
            }
        }
    }

    @Override
    public void execute(OperatorContext context) {
        ObservationStream stream = context.getInputStream();
        String source = stream.getSourceName();

        for (int row = 0; row < stream.size(); row++) {
            Observation obs = stream.get(row);
            String raw = obs.getRawTimestamp();
            if (raw == null && obs.getTimestamp() != null) {
                continue;
            }
            stream.setTimestamp(row, parse(source, row, raw, assumedOffset));
        }

        context.recordQuality("time_normalization.parsed", stream.size());
        log.debug("Source '{}': {} timestamps normalized to UTC (assumed offset {})",
                source, stream.size(), assumedOffset);
        context.setOutputStream(stream);
    }

    /**
     * 解析单个时间戳并换算到UTC。
     *
     * @throws MalformedTimestampException 文本无法解析时抛出
     */
    public static LocalDateTime parse(String source, int row, String raw, ZoneOffset assumedOffset) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedTimestampException(source, row, raw, null);
        }
        Matcher m = TIMESTAMP.matcher(raw.trim());
        if (!m.matches()) {
            throw new MalformedTimestampException(source, row, raw, null);
        }
        try {
            String[] ymd = m.group(1).split("-");
            LocalDate date = LocalDate.of(Integer.parseInt(ymd[0]), Integer.parseInt(ymd[1]), Integer.parseInt(ymd[2]));
            LocalTime time = LocalTime.MIDNIGHT;
            if (m.group(2) != null) {
                int second = m.group(4) != null ? Integer.parseInt(m.group(4)) : 0;
                int nanos = m.group(5) != null ? fractionToNanos(m.group(5)) : 0;
                time = LocalTime.of(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)), second, nanos);
            }
            ZoneOffset offset = m.group(6) != null ? parseOffset(m.group(6)) : assumedOffset;
            return LocalDateTime.of(date, time)
                    .atOffset(offset)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime();
        } catch (DateTimeException e) {
            throw new MalformedTimestampException(source, row, raw, e);
        }
    }

    private static ZoneOffset parseOffset(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        if ("Z".equals(upper) || "UTC".equals(upper)) {
            return ZoneOffset.UTC;
        }
        String digits = upper.substring(1).replace(":", "");
        int hours = Integer.parseInt(digits.substring(0, 2));
        int minutes = digits.length() > 2 ? Integer.parseInt(digits.substring(2)) : 0;
        int sign = upper.charAt(0) == '-' ? -1 : 1;
        return ZoneOffset.ofHoursMinutes(sign * hours, sign * minutes);
    }

    private static int fractionToNanos(String fraction) {
        StringBuilder padded = new StringBuilder(fraction);
        while (padded.length() < 9) {
            padded.append('0');
        }
        return Integer.parseInt(padded.toString());
    }

    @Override
    public void cleanup() {
        this.assumedOffset = null;
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(FUNCTION_ID, "1.0.0", "解析原始时间戳并换算为UTC本地时间")
                .withParameters(ParameterDefinition.of("assumedOffset", Type.STRING, false,
                        "时间戳不带偏移时假定的UTC偏移，覆盖契约声明"));
    }
}
