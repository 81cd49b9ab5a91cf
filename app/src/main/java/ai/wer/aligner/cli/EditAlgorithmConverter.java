package ai.wer.aligner.cli;

import ai.wer.aligner.diff.EditAlgorithm;
import picocli.CommandLine;

public class EditAlgorithmConverter implements CommandLine.ITypeConverter<EditAlgorithm> {

    @Override
    public EditAlgorithm convert(String value) {
        return EditAlgorithm.from(value);
    }
}
