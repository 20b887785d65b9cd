package win.ixuni.s3wire.core.operation;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.s3wire.core.request.RequestDescriptor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 请求构建器注册表
 * <p>
 * Looks up the builder for an operation's concrete class and runs it inside the
 * interceptors, lowest order outermost.
 */
@Slf4j
public class RequestBuilderRegistry {

    private final Map<Class<?>, RequestBuilder<?>> builders = new ConcurrentHashMap<>();

    // Immutable snapshot, replaced on every add
    private volatile List<RequestInterceptor> interceptors = List.of();

    public <O extends Operation<?>> void register(RequestBuilder<O> builder) {
        builders.put(builder.getOperationType(), builder);
        log.debug("Registered request builder for {}", builder.getOperationType().getSimpleName());
    }

    public synchronized void addInterceptor(RequestInterceptor interceptor) {
        List<RequestInterceptor> next = new ArrayList<>(interceptors);
        next.add(interceptor);
        // stable sort: equal orders keep registration order
        next.sort(Comparator.comparingInt(RequestInterceptor::getOrder));
        interceptors = List.copyOf(next);
        log.debug("Added interceptor {} (order {})", interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    /**
     * @throws UnsupportedOperationException no builder for the operation's class
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<?>> RequestDescriptor build(O operation) {
        RequestBuilder<O> builder = (RequestBuilder<O>) builders.get(operation.getClass());
        if (builder == null) {
            throw new UnsupportedOperationException(
                    "No request builder registered for operation: " + operation.getClass().getSimpleName());
        }

        List<RequestInterceptor> snapshot = interceptors;
        InterceptorChain<O> chain = builder::build;
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            RequestInterceptor interceptor = snapshot.get(i);
            InterceptorChain<O> inner = chain;
            chain = op -> interceptor.intercept(op, inner);
        }
        return chain.proceed(operation);
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return builders.containsKey(operationType);
    }

    public int size() {
        return builders.size();
    }

    public int interceptorCount() {
        return interceptors.size();
    }
}
