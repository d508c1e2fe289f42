package org.example.stackanalysis.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.stackanalysis.model.AnalysisParameters;
import org.example.stackanalysis.model.ImageRef;
import org.example.stackanalysis.model.ParameterBag;
import org.example.stackanalysis.model.ThresholdMethod;
import org.example.stackanalysis.repository.ImageStore;
import org.example.stackanalysis.service.ParameterValidationException;
import org.example.stackanalysis.variant.AnalysisVariant;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns the operator's values into {@link AnalysisParameters}, or reports every
 * reason it cannot. Runs before any file, process or message is created.
 */
@Service
@RequiredArgsConstructor
public class ParameterValidator {

    // Not RFC 5322; good enough to catch typos.
    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%-]+@[a-zA-Z0-9._%-]+\\.[a-zA-Z]{2,6}$");

    private final ImageStore imageStore;

    public static boolean isValidEmail(String address) {
        return address != null && EMAIL.matcher(address).matches();
    }

    /**
     * @param bag    operator values; missing keys fall back to the variant defaults
     * @param images images resolved from the selection
     * @throws ParameterValidationException listing all problems found
     */
    public AnalysisParameters validate(AnalysisVariant variant, ParameterBag bag, List<ImageRef> images) {
        ParameterBag values = new ParameterBag(variant.getDefaults()).withOverrides(bag.asMap());
        List<String> errors = new ArrayList<>();

        String dataType = values.getString(ParameterBag.DATA_TYPE);
        if (dataType != null && !"Image".equals(dataType) && !"Dataset".equals(dataType)) {
            errors.add("Data_Type must be 'Image' or 'Dataset', not '" + dataType + "'");
        }
        if (images == null || images.isEmpty()) {
            errors.add("No images selected");
            images = List.of();
        }

        String methodLabel = values.getString(ParameterBag.METHOD);
        Optional<ThresholdMethod> method = ThresholdMethod.fromLabel(methodLabel);
        if (method.isEmpty()) {
            errors.add("Unknown thresholding method: " + methodLabel + " (expected one of " + ThresholdMethod.labels() + ")");
        }

        boolean upload = values.getBoolean(ParameterBag.UPLOAD_RESULTS);
        boolean email = values.getBoolean(ParameterBag.EMAIL_RESULTS);
        if (!upload && !email) {
            errors.add("No results option selected");
        }

        String address = null;
        if (email) {
            address = values.getString(ParameterBag.EMAIL);
            if (address == null) {
                address = imageStore.currentUserEmail().orElse(null);
            }
            if (!isValidEmail(address)) {
                errors.add("No valid email address" + (address != null ? ": " + address : ""));
            }
        }

        AnalysisParameters parameters = AnalysisParameters.builder()
                .method(method.orElse(ThresholdMethod.OTSU))
                .channel1(values.getString(ParameterBag.CHANNEL_1))
                .channel2(values.getString(ParameterBag.CHANNEL_2))
                .channel3(values.getString(ParameterBag.CHANNEL_3))
                .permutations(intValue(values, ParameterBag.PERMUTATIONS, errors))
                .minimumShift(intValue(values, ParameterBag.MIN_SHIFT, errors))
                .maximumShift(intValue(values, ParameterBag.MAX_SHIFT, errors))
                .significance(doubleValue(values, ParameterBag.SIGNIFICANCE, errors))
                .intersect(values.getBoolean(ParameterBag.INTERSECT))
                .aggregateStack(values.getBoolean(ParameterBag.AGGREGATE_STACK))
                .uploadResults(upload)
                .emailResults(email)
                .email(address)
                .build();

        errors.addAll(variant.checkParameters(parameters, images));

        if (!errors.isEmpty()) {
            throw new ParameterValidationException(errors);
        }
        return parameters;
    }

    // Keys a variant does not use are absent from its defaults and read as 0.
    private static int intValue(ParameterBag values, String key, List<String> errors) {
        try {
            Integer v = values.getInt(key);
            return v == null ? 0 : v;
        } catch (NumberFormatException | ArithmeticException e) {
            errors.add(key + " is not a whole number: " + values.getString(key));
            return 0;
        }
    }

    private static double doubleValue(ParameterBag values, String key, List<String> errors) {
        try {
            Double v = values.getDouble(key);
            return v == null ? 0 : v;
        } catch (NumberFormatException e) {
            errors.add(key + " is not a number: " + values.getString(key));
            return 0;
        }
    }
}
