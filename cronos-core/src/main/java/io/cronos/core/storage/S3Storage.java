package io.cronos.core.storage;

import io.cronos.core.config.model.StorageConfig;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

public final class S3Storage implements Storage, AutoCloseable {
    private final S3Client client;
    private final String bucket;
    private final String prefix;
    private final boolean ownsClient;

    public S3Storage(StorageConfig config) {
        this(buildClient(config), config.bucket(), config.prefix(), true);
    }

    S3Storage(S3Client client, String bucket, String prefix) {
        this(client, bucket, prefix, false);
    }

    private S3Storage(S3Client client, String bucket, String prefix, boolean ownsClient) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket must not be blank");
        }
        this.bucket = bucket;
        this.prefix = normalizePrefix(prefix);
        this.ownsClient = ownsClient;
    }

    @Override
    public List<FileInfo> listFiles() throws StorageException {
        List<FileInfo> files = new ArrayList<>();
        String continuationToken = null;
        try {
            do {
                ListObjectsV2Request.Builder request = ListObjectsV2Request.builder().bucket(bucket);
                if (!prefix.isEmpty()) {
                    request.prefix(prefix);
                }
                if (continuationToken != null) {
                    request.continuationToken(continuationToken);
                }
                ListObjectsV2Response response = client.listObjectsV2(request.build());
                for (S3Object object : response.contents()) {
                    String name = object.key().substring(prefix.length());
                    files.add(new FileInfo(name, url(object.key())));
                }
                continuationToken = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
            } while (continuationToken != null);
            return files;
        } catch (SdkException e) {
            throw new StorageException("Failed to list s3://" + bucket + "/" + prefix, e);
        }
    }

    @Override
    public InputStream downloadFile(String name) throws StorageException {
        String key = key(name);
        try {
            return client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (NoSuchKeyException e) {
            throw new StorageObjectNotFoundException(name, e);
        } catch (SdkException e) {
            throw new StorageException("Failed to download " + url(key), e);
        }
    }

    @Override
    public FileInfo uploadFile(String name, InputStream data) throws StorageException {
        String key = key(name);
        try {
            byte[] bytes = data.readAllBytes();
            client.putObject(PutObjectRequest.builder().bucket(bucket).key(key).build(), RequestBody.fromBytes(bytes));
            return new FileInfo(name, url(key));
        } catch (IOException e) {
            throw new StorageException("Failed to read upload content for " + name, e);
        } catch (SdkException e) {
            throw new StorageException("Failed to upload " + url(key), e);
        }
    }

    @Override
    public void deleteFile(String name) throws StorageException {
        String key = key(name);
        try {
            client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException e) {
            throw new StorageException("Failed to delete " + url(key), e);
        }
    }

    @Override
    public void renameFile(String oldName, String newName) throws StorageException {
        String source = key(oldName);
        String target = key(newName);
        try {
            client.copyObject(CopyObjectRequest.builder()
                .sourceBucket(bucket)
                .sourceKey(source)
                .destinationBucket(bucket)
                .destinationKey(target)
                .build());
        } catch (NoSuchKeyException e) {
            throw new StorageObjectNotFoundException(oldName, e);
        } catch (SdkException e) {
            throw new StorageException("Failed to copy " + url(source) + " to " + url(target), e);
        }
        deleteFile(oldName);
    }

    @Override
    public void close() {
        if (ownsClient) {
            client.close();
        }
    }

    private String key(String name) throws StorageException {
        if (name == null || name.isBlank()) {
            throw new StorageException("object name must not be blank");
        }
        return prefix + name;
    }

    private String url(String key) {
        return "s3://" + bucket + "/" + key;
    }

    private static String normalizePrefix(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String trimmed = raw.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.isEmpty() || trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    private static S3Client buildClient(StorageConfig config) {
        String region = firstNonBlank(config.region(), System.getenv("AWS_REGION"), System.getenv("AWS_DEFAULT_REGION"));
        if (region == null) {
            throw new IllegalArgumentException("missing AWS region for S3 storage");
        }

        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(region))
            .credentialsProvider(resolveCredentialsProvider(config));

        if (config.endpoint() != null && !config.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(config.endpoint()));
            builder.serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        }
        return builder.build();
    }

    private static AwsCredentialsProvider resolveCredentialsProvider(StorageConfig config) {
        String accessKeyId = config.accessKeyId();
        String secretAccessKey = config.secretAccessKey();
        if (accessKeyId != null && !accessKeyId.isBlank() && secretAccessKey != null && !secretAccessKey.isBlank()) {
            String sessionToken = config.sessionToken();
            if (sessionToken != null && !sessionToken.isBlank()) {
                return StaticCredentialsProvider.create(
                    AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken)
                );
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
        }
        if (config.profile() != null && !config.profile().isBlank()) {
            return ProfileCredentialsProvider.create(config.profile());
        }
        return DefaultCredentialsProvider.create();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
