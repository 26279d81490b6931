package com.example.SmartNews.service.media;

import com.example.SmartNews.dto.TransformRequest;
import com.example.SmartNews.dto.TransformResult;

import java.io.IOException;

public interface VideoTransformer {

    TransformResult process(TransformRequest request, ProgressListener listener) throws IOException, TransformException;
}
