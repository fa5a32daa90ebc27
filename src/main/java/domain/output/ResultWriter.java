package domain.output;

import java.nio.file.Path;

import java.util.List;

import domain.model.FormatResult;

import domain.model.FormatWarning;

/** 결과 리포트를 저장하는 책임. */
public interface ResultWriter {

    void write(
            Path resultFile,
            List<FormatResult> results,
            List<FormatWarning> warnings
    );
}
