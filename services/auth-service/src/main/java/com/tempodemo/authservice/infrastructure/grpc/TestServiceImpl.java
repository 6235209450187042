package com.tempodemo.authservice.infrastructure.grpc;

import com.tempodemo.api.v1.SayHelloRequest;
import com.tempodemo.api.v1.SayHelloResponse;
import com.tempodemo.api.v1.TestServiceGrpc;
import io.grpc.stub.StreamObserver;
import net.devh.boot.grpc.server.service.GrpcService;

/**
 * Demo {@code api.v1.TestService}. {@code Register} is left to the generated base class and answers
 * {@code UNIMPLEMENTED}.
 */
@GrpcService
public class TestServiceImpl extends TestServiceGrpc.TestServiceImplBase {

    @Override
    public void sayHello(SayHelloRequest request, StreamObserver<SayHelloResponse> responseObserver) {
        responseObserver.onNext(
                SayHelloResponse.newBuilder().setText("Hello " + request.getName() + "!").build());
        responseObserver.onCompleted();
    }
}
