package com.formrules.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.formrules.generator.cli.exception.OptionsValidationException;
import com.formrules.generator.cli.model.GenerateOptions;
import com.formrules.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInputFile() == null) {
			errors.add("Input document is required (--input / -i).");
		} else if (!Files.isRegularFile(o.getInputFile())) {
			errors.add("Input document does not exist or is not a file: " + o.getInputFile());
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		Map<String, String> overrides = new LinkedHashMap<>();
		if (o.getNestingOverrides() != null) {
			o.getNestingOverrides().forEach((child, parent) -> {
				if (isBlank(child) || isBlank(parent)) {
					errors.add("Nesting override must have the form CHILD=PARENT. Got: " + child + "=" + parent);
				} else if (child.trim().equals(parent.trim())) {
					errors.add("A group cannot be its own parent: " + child);
				} else {
					overrides.put(child.trim(), parent.trim());
				}
			});
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path inputFile = o.getInputFile().toAbsolutePath().normalize();
		return new ValidatedGenerateOptions(inputFile, normalizedOutputDir, overrides);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
