package com.mailspider.core.output;

import com.mailspider.core.model.ExtractionResult;

import java.nio.file.Path;
import java.util.List;

/** 추출 결과 영속화 계약(append/헤더 규칙은 구현체 문서 참고). */
public interface ResultStore {

    /**
     * @param append true 이고 파일이 있으면 헤더 없이 이어쓰기, 아니면 새로 쓰고 헤더 포함
     */
    void write(List<ExtractionResult> results, Path file, boolean append);

    /** 파일이 없거나 비어 있으면 빈 목록 */
    List<ExtractionResult> read(Path file);
}
