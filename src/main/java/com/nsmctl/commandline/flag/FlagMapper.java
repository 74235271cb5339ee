package com.nsmctl.commandline.flag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.descriptor.ParameterDescriptor;
import com.nsmctl.commandline.descriptor.SemanticType;
import com.nsmctl.commandline.util.NamingUtil;
import com.nsmctl.commandline.util.Values;

/**
 * Derives a {@link FlagSpec} from one {@link ParameterDescriptor}.
 *
 * Precedence: boolean becomes a toggle; otherwise a list accepts one or more values; otherwise an
 * optional type or a non-empty default gives an optional scalar; anything else is a required scalar.
 * A non-empty external default replaces the declared one and always makes the flag optional.
 *
 * Stateless: the same descriptor and override always produce an equal FlagSpec.
 */
public class FlagMapper {

    private static final Logger log = LoggerFactory.getLogger(FlagMapper.class);

    public FlagSpec map(ParameterDescriptor parameter) {
        return map(parameter, null, null);
    }

    public FlagSpec map(ParameterDescriptor parameter, Object defaultOverride) {
        return map(parameter, defaultOverride, null);
    }

    /**
     * @param parameter       typed parameter to project
     * @param defaultOverride externally supplied default; ignored when empty
     * @param helpText        pre-resolved help; when null the descriptor's own description is used
     */
    public FlagSpec map(ParameterDescriptor parameter, Object defaultOverride, String helpText) {
        SemanticType type = parameter.getType();
        if (type == null) {
            throw new IllegalArgumentException("Parameter '" + parameter.getName() + "' has no declared type");
        }

        boolean overridden = Values.isTruthy(defaultOverride);
        Object defaultValue = overridden ? defaultOverride : parameter.getDefaultValue();
        boolean optional = overridden || type.isOptional() || Values.isTruthy(defaultValue);

        FlagSpec.FlagSpecBuilder flag = FlagSpec.builder()
                .name(parameter.getName())
                .flag(NamingUtil.toFlagName(parameter.getName()))
                .helpText(helpText != null ? helpText : parameter.getDescription())
                .defaultValue(defaultValue);

        if (type.isBoolean()) {
            flag.valueType(ValueType.NONE).required(false);
        } else if (type.isList()) {
            flag.valueType(scalarValueType(type)).multiplicity(Multiplicity.MANY).required(!optional);
        } else {
            flag.valueType(scalarValueType(type)).required(!optional);
        }

        FlagSpec spec = flag.build();
        log.debug("Mapped {} ({}) to {} required={} type={} multiplicity={}", parameter.getName(), type,
                spec.getPrimaryFlag(), spec.isRequired(), spec.getValueType(), spec.getMultiplicity());
        return spec;
    }

    /**
     * Narrowest of integer, float and string matching the declared type. Boolean list elements are read as strings.
     */
    static ValueType scalarValueType(SemanticType type) {
        return switch (type.scalarKind()) {
            case INTEGER -> ValueType.INTEGER;
            case FLOAT -> ValueType.FLOAT;
            default -> ValueType.STRING;
        };
    }
}
