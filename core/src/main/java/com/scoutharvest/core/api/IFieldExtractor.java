package com.scoutharvest.core.api;

import com.scoutharvest.core.extract.ExtractionFailedException;
import com.scoutharvest.core.model.RawFieldMap;

import java.net.URI;

/** 상세 페이지 마크업 → 원시 필드 맵 */
public interface IFieldExtractor {
    RawFieldMap extract(String html, URI pageUrl) throws ExtractionFailedException;
}
