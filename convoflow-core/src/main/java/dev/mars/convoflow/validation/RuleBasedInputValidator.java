/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.convoflow.validation;

import dev.mars.convoflow.core.ExecutionContext;
import dev.mars.convoflow.core.StateValidatorConfig;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Default input validator with a fixed set of rule types:
 * {@code required}, {@code text}, {@code pattern}, {@code number},
 * {@code choice}, {@code phone} and {@code otp}.
 * <p>
 * Every rule accepts a {@code message} config entry that replaces the default
 * suggested response.
 */
public class RuleBasedInputValidator implements InputValidator {

    private static final Logger logger = Logger.getLogger(RuleBasedInputValidator.class.getName());

    private static final Pattern MOBILE_NUMBER = Pattern.compile("^[6-9]\\d{9}$");
    private static final Pattern OTP = Pattern.compile("^\\d{4,6}$");
    private static final BigDecimal MAX_EXACT_LONG = BigDecimal.valueOf(Long.MAX_VALUE);

    @Override
    public InputValidationResult validate(StateValidatorConfig validator, ExecutionContext context) {
        Object raw = context.getData().get(USER_MESSAGE);
        String input = raw != null ? raw.toString().trim() : "";
        Map<String, Object> config = validator.getConfig();
        String type = validator.getType().toLowerCase(Locale.ROOT);

        InputValidationResult result;
        switch (type) {
            case "required":
                result = input.isEmpty()
                        ? invalid(config, "Input is required", "Please enter a response.")
                        : InputValidationResult.valid(input);
                break;
            case "text":
                result = validateText(input, config);
                break;
            case "pattern":
            case "regex":
                result = validatePattern(input, config);
                break;
            case "number":
                result = validateNumber(input, config);
                break;
            case "choice":
                result = validateChoice(input, config);
                break;
            case "phone":
                result = validatePhone(input, config);
                break;
            case "otp":
                result = OTP.matcher(input).matches()
                        ? InputValidationResult.valid(input)
                        : invalid(config, "Invalid OTP format", "Please enter the 4 to 6 digit code you received.");
                break;
            default:
                logger.warning("Unknown validator type '" + validator.getType() + "', accepting input");
                result = InputValidationResult.valid(input);
        }

        logger.fine("Validator " + type + " on '" + input + "': " + result);
        return result;
    }

    private InputValidationResult validateText(String input, Map<String, Object> config) {
        int minLength = intValue(config.get("minLength"), 1);
        Integer maxLength = config.containsKey("maxLength") ? intValue(config.get("maxLength"), Integer.MAX_VALUE) : null;
        if (input.length() < minLength) {
            return invalid(config, "Input too short (min: " + minLength + ")",
                    "Please enter at least " + minLength + " characters.");
        }
        if (maxLength != null && input.length() > maxLength) {
            return invalid(config, "Input too long (max: " + maxLength + ")",
                    "Please keep it under " + maxLength + " characters.");
        }
        return InputValidationResult.valid(input);
    }

    private InputValidationResult validatePattern(String input, Map<String, Object> config) {
        Object regex = config.get("regex");
        if (regex == null) {
            regex = config.get("pattern");
        }
        if (regex == null) {
            logger.warning("Pattern validator without regex, accepting input");
            return InputValidationResult.valid(input);
        }
        try {
            if (Pattern.compile(regex.toString()).matcher(input).matches()) {
                return InputValidationResult.valid(input);
            }
        } catch (PatternSyntaxException e) {
            logger.warning("Invalid validator regex '" + regex + "': " + e.getDescription());
            return InputValidationResult.valid(input);
        }
        return invalid(config, "Input does not match expected format", "That doesn't look right, please try again.");
    }

    private InputValidationResult validateNumber(String input, Map<String, Object> config) {
        BigDecimal number;
        try {
            number = new BigDecimal(input);
        } catch (NumberFormatException e) {
            return invalid(config, "Not a number: " + input, "Please enter a number.");
        }
        BigDecimal min = decimalValue(config.get("min"));
        BigDecimal max = decimalValue(config.get("max"));
        if (min != null && number.compareTo(min) < 0) {
            return invalid(config, "Number below minimum (" + min.toPlainString() + ")",
                    "Please enter a number of at least " + min.toPlainString() + ".");
        }
        if (max != null && number.compareTo(max) > 0) {
            return invalid(config, "Number above maximum (" + max.toPlainString() + ")",
                    "Please enter a number no greater than " + max.toPlainString() + ".");
        }
        if (number.stripTrailingZeros().scale() <= 0 && number.abs().compareTo(MAX_EXACT_LONG) <= 0) {
            return InputValidationResult.valid(number.longValue());
        }
        return InputValidationResult.valid(number.doubleValue());
    }

    private InputValidationResult validateChoice(String input, Map<String, Object> config) {
        Object rawOptions = config.get("options");
        if (!(rawOptions instanceof List<?> options) || options.isEmpty()) {
            logger.warning("Choice validator without options, accepting input");
            return InputValidationResult.valid(input);
        }
        for (Object option : options) {
            if (option != null && option.toString().equalsIgnoreCase(input)) {
                return InputValidationResult.valid(option);
            }
        }
        if (input.matches("\\d{1,9}")) {
            int index = Integer.parseInt(input);
            if (index >= 1 && index <= options.size()) {
                return InputValidationResult.valid(options.get(index - 1));
            }
        }
        StringBuilder menu = new StringBuilder("Please choose one of: ");
        for (int i = 0; i < options.size(); i++) {
            if (i > 0) {
                menu.append(", ");
            }
            menu.append(i + 1).append(". ").append(options.get(i));
        }
        return invalid(config, "Unrecognised choice: " + input, menu.toString());
    }

    private InputValidationResult validatePhone(String input, Map<String, Object> config) {
        String digits = input.replaceAll("[\\s-]", "");
        if (digits.startsWith("+91")) {
            digits = digits.substring(3);
        } else if (digits.length() == 12 && digits.startsWith("91")) {
            digits = digits.substring(2);
        }
        if (MOBILE_NUMBER.matcher(digits).matches()) {
            return InputValidationResult.valid(digits);
        }
        return invalid(config, "Invalid phone number", "Please enter a valid 10-digit mobile number.");
    }

    private InputValidationResult invalid(Map<String, Object> config, String reason, String suggestion) {
        Object message = config.get("message");
        return InputValidationResult.invalid(reason, message != null ? message.toString() : suggestion);
    }

    private static int intValue(Object value, int defaultValue) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer in validator config: " + value);
            }
        }
        return defaultValue;
    }

    private static BigDecimal decimalValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            logger.warning("Invalid number in validator config: " + value);
            return null;
        }
    }
}
