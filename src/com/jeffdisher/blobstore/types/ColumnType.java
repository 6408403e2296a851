package com.jeffdisher.blobstore.types;


/**
 * The role a column plays in a wide-column table.
 */
public enum ColumnType
{
	/** The column is part of the partition key (determines row placement). */
	PARTITION_KEY,
	/** The column is a cluster key (determines ordering within a partition). */
	CLUSTER_KEY,
	/** The column just contains data. */
	DATA_COLUMN,
}
